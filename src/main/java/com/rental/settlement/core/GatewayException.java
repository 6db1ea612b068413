package com.rental.settlement.core;

/**
 * Raised by gateway adapters when the gateway rejects a call or cannot be reached.
 */
public class GatewayException extends RuntimeException {

    public GatewayException(String message) {
        super(message);
    }

    public GatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
