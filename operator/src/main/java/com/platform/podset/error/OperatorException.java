package com.platform.podset.error;

/**
 * Base exception for all operator exceptions.
 * Carries an ErrorCode for standardized error handling.
 */
public abstract class OperatorException extends RuntimeException {

    private final ErrorCode errorCode;

    protected OperatorException(ErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }

    protected OperatorException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected OperatorException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public boolean isFatal() {
        return errorCode.isFatal();
    }
}
