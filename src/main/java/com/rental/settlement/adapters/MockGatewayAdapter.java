package com.rental.settlement.adapters;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.rental.settlement.core.GatewayException;
import com.rental.settlement.core.PaymentGatewayAdapter;
import com.rental.settlement.domain.RemoteOrder;
import com.rental.settlement.domain.RemoteRefund;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process gateway for local runs and tests. Ids are sequential per JVM. Orders at or above
 * {@link #DECLINE_THRESHOLD_MINOR} paise are declined so failure paths can be exercised.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "rental.gateway.provider", havingValue = "mock", matchIfMissing = true)
public class MockGatewayAdapter implements PaymentGatewayAdapter {

    static final long DECLINE_THRESHOLD_MINOR = 99_999_900L;

    private final ObjectMapper mapper = new ObjectMapper();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public String getGatewayName() {
        return "mock";
    }

    @Override
    public RemoteOrder createRemoteOrder(long amountMinor, String currency, String receipt, Map<String, String> notes) {
        if (amountMinor >= DECLINE_THRESHOLD_MINOR) {
            throw new GatewayException("Simulated decline for high amount");
        }
        String orderId = "order_mock_" + sequence.incrementAndGet();
        log.debug("MockGatewayAdapter created order {} amountMinor={} receipt={}", orderId, amountMinor, receipt);

        ObjectNode raw = mapper.createObjectNode();
        raw.put("id", orderId);
        raw.put("entity", "order");
        raw.put("amount", amountMinor);
        raw.put("currency", currency);
        raw.put("receipt", receipt);
        raw.put("status", "created");
        raw.set("notes", mapper.valueToTree(notes));
        return RemoteOrder.builder()
                .orderId(orderId)
                .amountMinor(amountMinor)
                .currency(currency)
                .receipt(receipt)
                .rawPayload(raw.toString())
                .build();
    }

    @Override
    public RemoteRefund refund(String externalPaymentId, long amountMinor, Map<String, String> notes) {
        String refundId = "rfnd_mock_" + sequence.incrementAndGet();
        log.debug("MockGatewayAdapter refunding paymentId={} amountMinor={} refundId={}", externalPaymentId, amountMinor, refundId);

        ObjectNode raw = mapper.createObjectNode();
        raw.put("id", refundId);
        raw.put("entity", "refund");
        raw.put("payment_id", externalPaymentId);
        raw.put("amount", amountMinor);
        raw.put("status", "pending");
        return RemoteRefund.builder()
                .refundId(refundId)
                .amountMinor(amountMinor)
                .rawPayload(raw.toString())
                .build();
    }
}
