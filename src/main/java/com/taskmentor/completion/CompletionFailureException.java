package com.taskmentor.completion;

/**
 * Raised when the completion service times out, errors or returns output that cannot be used.
 */
public class CompletionFailureException extends RuntimeException {

    private final String purpose;

    public CompletionFailureException(String purpose, String message) {
        super(purpose + ": " + message);
        this.purpose = purpose;
    }

    public CompletionFailureException(String purpose, String message, Throwable cause) {
        super(purpose + ": " + message, cause);
        this.purpose = purpose;
    }

    public String getPurpose() {
        return purpose;
    }
}
