package com.rental.settlement.api;

/**
 * Entity absent, or not visible to the caller. Both cases map to 404 so existence is not leaked.
 */
public class ResourceNotFoundException extends SettlementException {

    public static final String DEAL_NOT_FOUND = "DEAL_NOT_FOUND";
    public static final String CONVERSATION_NOT_FOUND = "CONVERSATION_NOT_FOUND";
    public static final String PAYMENT_NOT_FOUND = "PAYMENT_NOT_FOUND";

    public ResourceNotFoundException(String errorCode, String message) {
        super(errorCode, message);
    }
}
