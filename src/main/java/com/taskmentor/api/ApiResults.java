package com.taskmentor.api;

import com.taskmentor.tracker.ErrorKind;
import com.taskmentor.tracker.OperationResult;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * Maps failed operation results onto HTTP status codes.
 */
final class ApiResults {

    private ApiResults() {
    }

    static <T> T unwrap(OperationResult<T> result) {
        if (result.isSuccess()) {
            return result.value();
        }
        throw new ResponseStatusException(statusOf(result.errorKind()), result.message());
    }

    static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case PERSISTENCE -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
