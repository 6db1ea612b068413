package com.rental.settlement.api;

/**
 * Operation is not legal for the current deal or payment status (e.g. paying before the deal
 * completes, refunding a payment that was never captured, paying a deal twice, verifying against a stale order). Handler returns 400.
 */
public class InvalidStateException extends SettlementException {

    public static final String INVALID_DEAL_STATUS = "INVALID_DEAL_STATUS";
    public static final String INVALID_PAYMENT_STATUS = "INVALID_PAYMENT_STATUS";
    public static final String PAYMENT_ALREADY_COMPLETED = "PAYMENT_ALREADY_COMPLETED";
    public static final String ORDER_ID_MISMATCH = "ORDER_ID_MISMATCH";

    public InvalidStateException(String errorCode, String message) {
        super(errorCode, message);
    }
}
