package com.rental.settlement.api;

/**
 * Gateway signature did not match. Handler returns 400; the webhook endpoint acknowledges anyway.
 */
public class SignatureVerificationException extends SettlementException {

    public static final String INVALID_SIGNATURE = "INVALID_SIGNATURE";
    public static final String INVALID_WEBHOOK_SIGNATURE = "INVALID_WEBHOOK_SIGNATURE";

    public SignatureVerificationException(String errorCode, String message) {
        super(errorCode, message);
    }
}
