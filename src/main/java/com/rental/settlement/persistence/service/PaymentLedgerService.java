package com.rental.settlement.persistence.service;

import com.rental.settlement.api.InvalidStateException;
import com.rental.settlement.api.ResourceNotFoundException;
import com.rental.settlement.domain.DealPaymentStatus;
import com.rental.settlement.domain.EventOutcome;
import com.rental.settlement.domain.OrderRequest;
import com.rental.settlement.domain.PaymentEventName;
import com.rental.settlement.domain.PaymentEventRecord;
import com.rental.settlement.domain.PaymentMethod;
import com.rental.settlement.domain.PaymentRecord;
import com.rental.settlement.domain.PaymentStatus;
import com.rental.settlement.domain.RemoteOrder;
import com.rental.settlement.domain.RemoteRefund;
import com.rental.settlement.persistence.entity.PaymentEntity;
import com.rental.settlement.persistence.entity.PaymentEventEntity;
import com.rental.settlement.persistence.repository.DealRepository;
import com.rental.settlement.persistence.repository.PaymentEventRepository;
import com.rental.settlement.persistence.repository.PaymentRepository;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Payment side of the ledger. Holds no state of its own: every transition is a conditional
 * update against the persisted status, followed by an append to the payment event log in the
 * same transaction. Gateway calls never happen in here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentLedgerService {

    static final int MAX_PAYLOAD_LENGTH = 10_000;

    private final PaymentRepository paymentRepository;
    private final PaymentEventRepository eventRepository;
    private final DealRepository dealRepository;

    @Transactional(readOnly = true)
    public Optional<PaymentRecord> findByDealId(String dealId) {
        return paymentRepository.findByDealId(dealId).map(PaymentEntity::toRecord);
    }

    @Transactional(readOnly = true)
    public Optional<PaymentRecord> findByExternalOrderId(String externalOrderId) {
        if (externalOrderId == null) {
            return Optional.empty();
        }
        return paymentRepository.findByExternalOrderId(externalOrderId).map(PaymentEntity::toRecord);
    }

    @Transactional(readOnly = true)
    public Optional<PaymentRecord> findByExternalPaymentId(String externalPaymentId) {
        if (externalPaymentId == null) {
            return Optional.empty();
        }
        return paymentRepository.findByExternalPaymentId(externalPaymentId).map(PaymentEntity::toRecord);
    }

    @Transactional(readOnly = true)
    public List<PaymentEventRecord> findEvents(String paymentId) {
        return eventRepository.findByPaymentIdOrderByCreatedAtDesc(paymentId).stream()
                .map(PaymentEventEntity::toRecord)
                .collect(Collectors.toList());
    }

    /**
     * Creates or refreshes the payment of a deal for a new gateway order and moves it to
     * INITIATED. The deal row is locked first so concurrent order requests for the same deal
     * serialize instead of racing on the unique deal constraint.
     *
     * @throws InvalidStateException when the payment is already completed, refunded or cancelled
     */
    @Transactional
    public PaymentRecord recordOrder(OrderRequest request, RemoteOrder order, String notes) {
        dealRepository.findByIdForUpdate(request.getDealId())
                .orElseThrow(() -> new ResourceNotFoundException(ResourceNotFoundException.DEAL_NOT_FOUND, "Deal not found"));

        Optional<PaymentEntity> existingOpt = paymentRepository.findByDealIdForUpdate(request.getDealId());
        PaymentEntity payment;
        if (existingOpt.isPresent()) {
            payment = existingOpt.get();
            ensureOrderable(payment.getStatus());
            payment.setExternalOrderId(order.getOrderId());
            payment.setAmount(order.getAmountMinor());
            payment.setStatus(PaymentStatus.INITIATED);
            payment.setFailedAt(null);
            if (request.getDescription() != null) {
                payment.setDescription(request.getDescription());
            }
        } else {
            payment = PaymentEntity.builder()
                    .dealId(request.getDealId())
                    .payerId(request.getPayerId())
                    .amount(order.getAmountMinor())
                    .currency(order.getCurrency())
                    .description(request.getDescription())
                    .externalOrderId(order.getOrderId())
                    .status(PaymentStatus.INITIATED)
                    .notes(notes)
                    .build();
        }
        PaymentEntity saved = paymentRepository.save(payment);
        appendEvent(saved.getId(), PaymentEventName.PAYMENT_INITIATED, EventOutcome.SUCCESS, order.getRawPayload(), null);
        log.info("Payment order recorded: dealId={} paymentId={} orderId={} amount={}",
                saved.getDealId(), saved.getId(), saved.getExternalOrderId(), saved.getAmount());
        return saved.toRecord();
    }

    public static void ensureOrderable(PaymentStatus status) {
        if (status == PaymentStatus.COMPLETED) {
            throw new InvalidStateException(InvalidStateException.PAYMENT_ALREADY_COMPLETED, "Payment already completed for this deal");
        }
        if (status == PaymentStatus.REFUNDED || status == PaymentStatus.CANCELLED) {
            throw new InvalidStateException(InvalidStateException.INVALID_PAYMENT_STATUS,
                    "Payment for this deal is " + status + " and cannot be restarted");
        }
    }

    /**
     * Audits a failed checkout signature. Committed on its own so the record survives the
     * exception the caller raises next.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void recordSignatureFailure(String paymentId, String externalOrderId, String externalPaymentId) {
        String payload = "{\"orderId\":\"" + externalOrderId + "\",\"paymentId\":\"" + externalPaymentId + "\"}";
        appendEvent(paymentId, PaymentEventName.SIGNATURE_VERIFICATION_FAILED, EventOutcome.FAILED,
                payload, "Signature verification failed");
    }

    /**
     * Moves a payment awaiting capture to COMPLETED and marks its deal paid. Only the caller
     * whose conditional update wins gets {@code applied = true}; everybody else receives the
     * current row and decides from its status.
     *
     * @param signature checkout signature, or null when the capture comes from a webhook
     * @param method    payment instrument, or null when unknown
     */
    @Transactional
    public Transition applyCapture(String paymentId, String externalPaymentId, String signature,
                                   PaymentMethod method, String rawPayload) {
        lockForTransition(paymentId);
        Instant now = Instant.now();
        int updated = paymentRepository.markCompleted(paymentId, externalPaymentId, signature, method, now,
                PaymentStatus.COMPLETED, PaymentStatus.AWAITING_CAPTURE);
        PaymentEntity payment = load(paymentId);
        if (updated == 0) {
            log.debug("Capture not applied, payment already {}: paymentId={}", payment.getStatus(), paymentId);
            return new Transition(payment.toRecord(), false);
        }
        int dealsUpdated = dealRepository.markPaidIfUnpaid(payment.getDealId(), externalPaymentId, now,
                DealPaymentStatus.PAID, DealPaymentStatus.UNPAID);
        if (dealsUpdated == 0) {
            log.warn("Deal was already marked paid: dealId={} paymentId={}", payment.getDealId(), paymentId);
        }
        appendEvent(paymentId, PaymentEventName.PAYMENT_COMPLETED, EventOutcome.SUCCESS, rawPayload, null);
        log.info("Payment completed: paymentId={} dealId={} externalPaymentId={}", paymentId, payment.getDealId(), externalPaymentId);
        return new Transition(payment.toRecord(), true);
    }

    @Transactional
    public void recordAuthorization(String paymentId, String rawPayload) {
        appendEvent(paymentId, PaymentEventName.PAYMENT_AUTHORIZED, EventOutcome.SUCCESS, rawPayload, null);
    }

    /**
     * Marks a payment awaiting capture as FAILED. A failure report for a payment that already
     * moved on is audited but never downgrades it.
     */
    @Transactional
    public Transition applyFailure(String paymentId, String rawPayload, String reason) {
        lockForTransition(paymentId);
        int updated = paymentRepository.markFailed(paymentId, Instant.now(), PaymentStatus.FAILED, PaymentStatus.AWAITING_CAPTURE);
        PaymentEntity payment = load(paymentId);
        String message = updated == 1
                ? reason
                : "Failure report ignored: payment is " + payment.getStatus();
        appendEvent(paymentId, PaymentEventName.PAYMENT_FAILED, EventOutcome.FAILED, rawPayload, message);
        if (updated == 1) {
            log.info("Payment failed: paymentId={} dealId={} reason={}", paymentId, payment.getDealId(), reason);
        }
        return new Transition(payment.toRecord(), updated == 1);
    }

    /**
     * Moves a COMPLETED payment to REFUNDED. A repeated confirmation is a no-op; a confirmation
     * for a payment in any other status is audited as failed.
     */
    @Transactional
    public Transition applyRefundCompletion(String paymentId, String rawPayload) {
        lockForTransition(paymentId);
        int updated = paymentRepository.markRefunded(paymentId, Instant.now(), PaymentStatus.REFUNDED, PaymentStatus.COMPLETED);
        PaymentEntity payment = load(paymentId);
        if (updated == 1) {
            appendEvent(paymentId, PaymentEventName.REFUND_COMPLETED, EventOutcome.SUCCESS, rawPayload, null);
            log.info("Payment refunded: paymentId={} dealId={}", paymentId, payment.getDealId());
        } else if (payment.getStatus() != PaymentStatus.REFUNDED) {
            appendEvent(paymentId, PaymentEventName.REFUND_COMPLETED, EventOutcome.FAILED, rawPayload,
                    "Refund confirmation ignored: payment is " + payment.getStatus());
        }
        return new Transition(payment.toRecord(), updated == 1);
    }

    @Transactional
    public void recordOrphan(String eventName, String rawPayload) {
        appendEvent(null, PaymentEventName.ORPHAN_WEBHOOK, EventOutcome.FAILED, rawPayload,
                "No payment matches webhook event " + eventName);
    }

    /**
     * Takes the refund slot of a completed payment.
     *
     * @return false when the payment is not COMPLETED or a refund was already started
     */
    @Transactional
    public boolean claimRefund(String paymentId) {
        return paymentRepository.claimRefund(paymentId, Instant.now(), PaymentStatus.COMPLETED) == 1;
    }

    @Transactional
    public void releaseRefundClaim(String paymentId) {
        paymentRepository.releaseRefundClaim(paymentId, Instant.now());
    }

    @Transactional
    public PaymentRecord recordRefundInitiated(String paymentId, RemoteRefund refund) {
        paymentRepository.recordRefundId(paymentId, refund.getRefundId(), Instant.now());
        appendEvent(paymentId, PaymentEventName.REFUND_INITIATED, EventOutcome.SUCCESS, refund.getRawPayload(), null);
        return load(paymentId).toRecord();
    }

    /**
     * Serializes writers of one payment, so a competing writer evaluates its conditional update
     * against the committed winner instead of failing on the row lock.
     */
    private void lockForTransition(String paymentId) {
        paymentRepository.findByIdForUpdate(paymentId)
                .orElseThrow(() -> new ResourceNotFoundException(ResourceNotFoundException.PAYMENT_NOT_FOUND, "Payment not found"));
    }

    private PaymentEntity load(String paymentId) {
        return paymentRepository.findById(paymentId)
                .orElseThrow(() -> new ResourceNotFoundException(ResourceNotFoundException.PAYMENT_NOT_FOUND, "Payment not found"));
    }

    private void appendEvent(String paymentId, PaymentEventName name, EventOutcome outcome, String rawPayload, String errorMessage) {
        PaymentEventEntity event = PaymentEventEntity.builder()
                .paymentId(paymentId)
                .eventName(name)
                .outcome(outcome)
                .rawPayload(truncate(rawPayload, MAX_PAYLOAD_LENGTH))
                .errorMessage(truncate(errorMessage, 1000))
                .build();
        eventRepository.save(event);
        log.debug("Payment event appended: paymentId={} event={} outcome={}", paymentId, name, outcome);
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }

    @Value
    public static class Transition {
        PaymentRecord payment;
        /** True when this call performed the status change. */
        boolean applied;
    }
}
