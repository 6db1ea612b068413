package com.rental.settlement.api;

/**
 * Thrown when the payment gateway call failed, timed out or was short-circuited.
 * No ledger state was changed, so the client may retry. Handler returns HTTP 503.
 */
public class GatewayUnavailableException extends SettlementException {

    public static final String GATEWAY_UNAVAILABLE = "GATEWAY_UNAVAILABLE";

    public GatewayUnavailableException(String message) {
        super(GATEWAY_UNAVAILABLE, message);
    }

    public GatewayUnavailableException(String message, Throwable cause) {
        super(GATEWAY_UNAVAILABLE, message, cause);
    }
}
