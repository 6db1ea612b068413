package com.rental.settlement.api;

/**
 * Base for errors raised by the deal and payment services. Each carries a stable code that
 * {@link GlobalExceptionHandler} returns as {@code error} alongside the HTTP status of the subtype.
 */
public abstract class SettlementException extends RuntimeException {

    private final String errorCode;

    protected SettlementException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected SettlementException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
