package com.taskmentor.entity;

public enum ConfirmationAction {
    DELETE,
    UPDATE_STATUS,
    UPDATE_PRIORITY
}
