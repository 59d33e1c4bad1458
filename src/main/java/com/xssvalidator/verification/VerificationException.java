package com.xssvalidator.verification;

/**
 * Typed failure of a call to the browser verification service, categorized so callers
 * can tell a busy server from an unreachable one.
 */
public class VerificationException extends Exception {

    public enum ErrorType {
        CONNECTION_ERROR,
        TIMEOUT,
        HTTP_ERROR,
        PARSE_ERROR,
        SERVER_BUSY
    }

    private final ErrorType errorType;

    public VerificationException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public VerificationException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() { return errorType; }
}
