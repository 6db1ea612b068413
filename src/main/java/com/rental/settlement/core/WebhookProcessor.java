package com.rental.settlement.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rental.settlement.api.SignatureVerificationException;
import com.rental.settlement.compliance.SettlementAuditLogger;
import com.rental.settlement.domain.PaymentEventName;
import com.rental.settlement.domain.PaymentMethod;
import com.rental.settlement.domain.PaymentRecord;
import com.rental.settlement.domain.PaymentStatus;
import com.rental.settlement.domain.WebhookOutcome;
import com.rental.settlement.messaging.PaymentEventProducer;
import com.rental.settlement.persistence.service.PaymentLedgerService;
import com.rental.settlement.persistence.service.PaymentLedgerService.Transition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Applies gateway webhooks to the payment ledger. Deliveries may arrive late, twice, or
 * before the client's own verification; every transition is conditional on the stored
 * status, so replays settle into the same final state.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookProcessor {

    static final String PAYMENT_AUTHORIZED = "payment.authorized";
    static final String PAYMENT_COMPLETED = "payment.completed";
    static final String PAYMENT_CAPTURED = "payment.captured";
    static final String PAYMENT_FAILED = "payment.failed";
    static final String REFUND_COMPLETED = "refund.completed";
    static final String REFUND_PROCESSED = "refund.processed";

    private final GatewaySignatureVerifier signatureVerifier;
    private final WebhookDeduplicationService deduplicationService;
    private final PaymentLedgerService paymentLedger;
    private final PaymentEventProducer eventProducer;
    private final SettlementAuditLogger auditLogger;
    private final ObjectMapper objectMapper;

    /**
     * @param rawBody   request body exactly as received; the signature covers these bytes
     * @param signature hex HMAC from the gateway's signature header
     * @param eventId   gateway delivery id, used for de-duplication when present
     * @throws SignatureVerificationException when the signature does not match
     */
    public WebhookOutcome process(String rawBody, String signature, String eventId) {
        if (!signatureVerifier.verifyWebhookSignature(rawBody, signature)) {
            auditLogger.webhookSignatureRejected(eventId, rawBody == null ? 0 : rawBody.getBytes(StandardCharsets.UTF_8).length);
            throw new SignatureVerificationException(SignatureVerificationException.INVALID_WEBHOOK_SIGNATURE,
                    "Invalid webhook signature");
        }

        JsonNode root = parse(rawBody);
        String event = root.path("event").asText("");

        if (!deduplicationService.claim(eventId, event)) {
            return WebhookOutcome.DUPLICATE;
        }
        try {
            WebhookOutcome outcome = dispatch(event, root.path("payload"), rawBody, eventId);
            log.info("Webhook processed: event={} eventId={} outcome={}", event, eventId, outcome);
            return outcome;
        } catch (RuntimeException e) {
            deduplicationService.release(eventId);
            throw e;
        }
    }

    private JsonNode parse(String rawBody) {
        try {
            return objectMapper.readTree(rawBody);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Webhook body is not valid JSON", e);
        }
    }

    private WebhookOutcome dispatch(String event, JsonNode payload, String rawBody, String eventId) {
        JsonNode paymentEntity = payload.path("payment").path("entity");
        String externalPaymentId = text(paymentEntity, "id");
        String externalOrderId = text(paymentEntity, "order_id");

        switch (event) {
            case PAYMENT_AUTHORIZED: {
                Optional<PaymentRecord> payment = paymentLedger.findByExternalOrderId(externalOrderId);
                if (payment.isEmpty()) {
                    return orphan(event, eventId, externalOrderId, externalPaymentId, rawBody);
                }
                paymentLedger.recordAuthorization(payment.get().getId(), rawBody);
                return WebhookOutcome.AUDITED;
            }
            case PAYMENT_COMPLETED:
            case PAYMENT_CAPTURED: {
                Optional<PaymentRecord> payment = paymentLedger.findByExternalPaymentId(externalPaymentId)
                        .or(() -> paymentLedger.findByExternalOrderId(externalOrderId));
                if (payment.isEmpty()) {
                    return orphan(event, eventId, externalOrderId, externalPaymentId, rawBody);
                }
                return capture(payment.get(), externalPaymentId, text(paymentEntity, "method"), rawBody);
            }
            case PAYMENT_FAILED: {
                Optional<PaymentRecord> payment = paymentLedger.findByExternalOrderId(externalOrderId);
                if (payment.isEmpty()) {
                    return orphan(event, eventId, externalOrderId, externalPaymentId, rawBody);
                }
                String reason = text(paymentEntity, "error_description");
                Transition transition = paymentLedger.applyFailure(payment.get().getId(), rawBody,
                        reason != null ? reason : "Payment failed");
                if (transition.isApplied()) {
                    eventProducer.publish(PaymentEventName.PAYMENT_FAILED, transition.getPayment());
                    return WebhookOutcome.APPLIED;
                }
                return WebhookOutcome.AUDITED;
            }
            case REFUND_COMPLETED:
            case REFUND_PROCESSED: {
                String refundedPaymentId = text(payload.path("refund").path("entity"), "payment_id");
                Optional<PaymentRecord> payment = paymentLedger.findByExternalPaymentId(refundedPaymentId);
                if (payment.isEmpty()) {
                    return orphan(event, eventId, null, refundedPaymentId, rawBody);
                }
                return refund(payment.get(), rawBody);
            }
            default:
                log.info("Unhandled webhook event: {} eventId={}", event, eventId);
                return WebhookOutcome.IGNORED;
        }
    }

    private WebhookOutcome capture(PaymentRecord payment, String externalPaymentId, String method, String rawBody) {
        Transition transition = paymentLedger.applyCapture(payment.getId(), externalPaymentId, null,
                PaymentMethod.fromGatewayMethod(method), rawBody);
        PaymentRecord current = transition.getPayment();
        if (transition.isApplied()) {
            auditLogger.paymentCompleted(current.getDealId(), current.getId(), externalPaymentId, "webhook");
            eventProducer.publish(PaymentEventName.PAYMENT_COMPLETED, current);
            return WebhookOutcome.APPLIED;
        }
        if (current.getStatus() == PaymentStatus.COMPLETED) {
            return WebhookOutcome.ALREADY_APPLIED;
        }
        log.warn("Capture webhook for payment in status {} not applied: paymentId={}", current.getStatus(), current.getId());
        return WebhookOutcome.IGNORED;
    }

    private WebhookOutcome refund(PaymentRecord payment, String rawBody) {
        Transition transition = paymentLedger.applyRefundCompletion(payment.getId(), rawBody);
        PaymentRecord current = transition.getPayment();
        if (transition.isApplied()) {
            auditLogger.refundCompleted(current.getDealId(), current.getId());
            eventProducer.publish(PaymentEventName.REFUND_COMPLETED, current);
            return WebhookOutcome.APPLIED;
        }
        return current.getStatus() == PaymentStatus.REFUNDED ? WebhookOutcome.ALREADY_APPLIED : WebhookOutcome.AUDITED;
    }

    private WebhookOutcome orphan(String event, String eventId, String externalOrderId, String externalPaymentId, String rawBody) {
        paymentLedger.recordOrphan(event, rawBody);
        auditLogger.orphanWebhook(eventId, event, externalOrderId, externalPaymentId);
        return WebhookOutcome.ORPHAN;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isMissingNode() || value.isNull() ? null : value.asText();
    }
}
