package com.rental.settlement.api;

/**
 * Caller is authenticated but its role does not allow the operation. Handler returns 403.
 */
public class ForbiddenOperationException extends SettlementException {

    public static final String FORBIDDEN = "FORBIDDEN";

    public ForbiddenOperationException(String message) {
        super(FORBIDDEN, message);
    }
}
