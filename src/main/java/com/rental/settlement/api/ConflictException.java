package com.rental.settlement.api;

/**
 * Completed deals that cannot change, or a competing operation already holds the resource.
 * Handler returns 409.
 */
public class ConflictException extends SettlementException {

    public static final String DEAL_ALREADY_COMPLETED = "DEAL_ALREADY_COMPLETED";
    public static final String REFUND_IN_PROGRESS = "REFUND_IN_PROGRESS";

    public ConflictException(String errorCode, String message) {
        super(errorCode, message);
    }
}
