package com.rental.settlement.compliance;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes security-relevant settlement facts as {@code [AUDIT]} log lines for retention and
 * reporting. Signatures and gateway secrets are never written.
 */
@Slf4j
@Component
public class SettlementAuditLogger {

    public void paymentSignatureRejected(String dealId, String paymentId, String externalOrderId, String externalPaymentId) {
        log.warn("[AUDIT] PAYMENT_SIGNATURE_REJECTED dealId={} paymentId={} orderId={} externalPaymentId={}",
                dealId, paymentId, externalOrderId, externalPaymentId);
    }

    public void webhookSignatureRejected(String eventId, int bodyLength) {
        log.warn("[AUDIT] WEBHOOK_SIGNATURE_REJECTED eventId={} bodyLength={}", eventId, bodyLength);
    }

    public void paymentCompleted(String dealId, String paymentId, String externalPaymentId, String source) {
        log.info("[AUDIT] PAYMENT_COMPLETED dealId={} paymentId={} externalPaymentId={} source={}",
                dealId, paymentId, externalPaymentId, source);
    }

    public void orphanWebhook(String eventId, String eventName, String externalOrderId, String externalPaymentId) {
        log.warn("[AUDIT] ORPHAN_WEBHOOK eventId={} event={} orderId={} externalPaymentId={}",
                eventId, eventName, externalOrderId, externalPaymentId);
    }

    public void refundInitiated(String dealId, String paymentId, long amount, String requestedBy, String reason) {
        log.info("[AUDIT] REFUND_INITIATED dealId={} paymentId={} amount={} requestedBy={} reason={}",
                dealId, paymentId, amount, requestedBy, reason);
    }

    public void refundCompleted(String dealId, String paymentId) {
        log.info("[AUDIT] REFUND_COMPLETED dealId={} paymentId={}", dealId, paymentId);
    }
}
