package com.rental.settlement.domain;

import java.util.Locale;

/**
 * Payment instrument used by the payer, normalized from the gateway's method names.
 */
public enum PaymentMethod {
    CREDIT_CARD,
    DEBIT_CARD,
    NET_BANKING,
    UPI,
    WALLET,
    EMI;

    /**
     * Maps a gateway method name (card, debit_card, netbanking, upi, wallet, emandate).
     *
     * @return the method, or null when the name is absent or unknown
     */
    public static PaymentMethod fromGatewayMethod(String method) {
        if (method == null || method.isBlank()) {
            return null;
        }
        switch (method.trim().toLowerCase(Locale.ROOT)) {
            case "card":
                return CREDIT_CARD;
            case "debit_card":
                return DEBIT_CARD;
            case "netbanking":
                return NET_BANKING;
            case "upi":
                return UPI;
            case "wallet":
                return WALLET;
            case "emandate":
                return EMI;
            default:
                return null;
        }
    }
}
