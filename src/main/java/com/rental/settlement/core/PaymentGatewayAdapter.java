package com.rental.settlement.core;

import com.rental.settlement.domain.RemoteOrder;
import com.rental.settlement.domain.RemoteRefund;

import java.util.Map;

/**
 * What every payment gateway integration needs to implement. Takes amounts in the smallest
 * currency unit and returns the gateway's identifiers; signature checks live in
 * {@link GatewaySignatureVerifier}.
 * <p>
 * Implementations throw {@link GatewayException} on any rejection or transport failure. The
 * framework bounds every call with a time limit and a circuit breaker and never retries.
 */
public interface PaymentGatewayAdapter {

    /**
     * Name of this gateway (like "razorpay"). Used as the circuit breaker instance name.
     */
    String getGatewayName();

    /**
     * Create a remote order the client can pay against.
     *
     * @param amountMinor amount in paise
     * @param receipt     merchant receipt reference
     * @param notes       key/value metadata stored with the order at the gateway
     */
    RemoteOrder createRemoteOrder(long amountMinor, String currency, String receipt, Map<String, String> notes);

    /**
     * Refund a captured payment. The gateway confirms completion later by webhook.
     */
    RemoteRefund refund(String externalPaymentId, long amountMinor, Map<String, String> notes);
}
