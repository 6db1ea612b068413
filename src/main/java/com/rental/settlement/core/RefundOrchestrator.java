package com.rental.settlement.core;

import com.rental.settlement.api.ConflictException;
import com.rental.settlement.api.ForbiddenOperationException;
import com.rental.settlement.api.GatewayUnavailableException;
import com.rental.settlement.api.InvalidStateException;
import com.rental.settlement.api.ResourceNotFoundException;
import com.rental.settlement.compliance.SettlementAuditLogger;
import com.rental.settlement.domain.ActingUser;
import com.rental.settlement.domain.PaymentEventName;
import com.rental.settlement.domain.PaymentRecord;
import com.rental.settlement.domain.PaymentStatus;
import com.rental.settlement.domain.RefundReceipt;
import com.rental.settlement.domain.RemoteRefund;
import com.rental.settlement.messaging.PaymentEventProducer;
import com.rental.settlement.persistence.service.PaymentLedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Full refunds of captured success-fee payments, requested by an administrator. The refund
 * slot is claimed in the ledger before the gateway is called, so two concurrent requests
 * cannot both reach the gateway. The payment stays COMPLETED until the gateway confirms the
 * refund by webhook.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RefundOrchestrator {

    static final String DEFAULT_REASON = "Manual refund";

    private final PaymentLedgerService paymentLedger;
    private final PaymentGatewayAdapter gatewayAdapter;
    private final GatewayCallExecutor gatewayCallExecutor;
    private final PaymentEventProducer eventProducer;
    private final SettlementAuditLogger auditLogger;

    /**
     * @param reason      free text sent to the gateway; {@value #DEFAULT_REASON} when blank
     * @param requester   must be an admin; recorded in the audit trail
     * @throws ForbiddenOperationException when the requester is not an admin
     * @throws ResourceNotFoundException   when the deal has no captured payment
     * @throws InvalidStateException       when the payment is not COMPLETED
     * @throws ConflictException           when a refund was already started
     * @throws GatewayUnavailableException when the gateway fails; the claim is released
     */
    public RefundReceipt refund(String dealId, String reason, ActingUser requester) {
        if (!requester.isAdmin()) {
            throw new ForbiddenOperationException("Only admins can refund payments");
        }
        PaymentRecord payment = paymentLedger.findByDealId(dealId)
                .filter(p -> p.getExternalPaymentId() != null)
                .orElseThrow(() -> new ResourceNotFoundException(ResourceNotFoundException.PAYMENT_NOT_FOUND,
                        "No captured payment found for this deal"));
        if (payment.getStatus() != PaymentStatus.COMPLETED) {
            throw new InvalidStateException(InvalidStateException.INVALID_PAYMENT_STATUS,
                    "Only completed payments can be refunded, payment is " + payment.getStatus());
        }
        if (!paymentLedger.claimRefund(payment.getId())) {
            throw new ConflictException(ConflictException.REFUND_IN_PROGRESS, "A refund is already in progress for this payment");
        }

        String effectiveReason = reason == null || reason.isBlank() ? DEFAULT_REASON : reason;
        Map<String, String> notes = new LinkedHashMap<>();
        notes.put("dealId", dealId);
        notes.put("reason", effectiveReason);

        RemoteRefund remoteRefund;
        try {
            remoteRefund = gatewayCallExecutor.execute(gatewayAdapter.getGatewayName(), "refund",
                    () -> gatewayAdapter.refund(payment.getExternalPaymentId(), payment.getAmount(), notes));
        } catch (GatewayUnavailableException e) {
            paymentLedger.releaseRefundClaim(payment.getId());
            log.warn("Refund failed at gateway, claim released: dealId={} paymentId={}", dealId, payment.getId());
            throw e;
        }

        PaymentRecord updated = paymentLedger.recordRefundInitiated(payment.getId(), remoteRefund);
        auditLogger.refundInitiated(dealId, payment.getId(), payment.getAmount(), requester.getUserId(), effectiveReason);
        eventProducer.publish(PaymentEventName.REFUND_INITIATED, updated);

        return RefundReceipt.builder()
                .dealId(dealId)
                .paymentId(updated.getId())
                .externalPaymentId(updated.getExternalPaymentId())
                .externalRefundId(remoteRefund.getRefundId())
                .amount(updated.getAmount())
                .currency(updated.getCurrency())
                .paymentStatus(updated.getStatus())
                .reason(effectiveReason)
                .initiatedAt(updated.getRefundInitiatedAt())
                .build();
    }
}
