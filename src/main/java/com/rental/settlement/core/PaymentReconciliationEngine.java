package com.rental.settlement.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.rental.settlement.api.GatewayUnavailableException;
import com.rental.settlement.api.InvalidStateException;
import com.rental.settlement.api.ResourceNotFoundException;
import com.rental.settlement.api.SignatureVerificationException;
import com.rental.settlement.compliance.SettlementAuditLogger;
import com.rental.settlement.config.GatewayProperties;
import com.rental.settlement.domain.ActingUser;
import com.rental.settlement.domain.DealStatus;
import com.rental.settlement.domain.DealView;
import com.rental.settlement.domain.OrderRequest;
import com.rental.settlement.domain.PartySummary;
import com.rental.settlement.domain.PaymentDetails;
import com.rental.settlement.domain.PaymentEventName;
import com.rental.settlement.domain.PaymentOrder;
import com.rental.settlement.domain.PaymentRecord;
import com.rental.settlement.domain.PaymentStatus;
import com.rental.settlement.domain.RemoteOrder;
import com.rental.settlement.domain.VerificationRequest;
import com.rental.settlement.messaging.PaymentEventProducer;
import com.rental.settlement.persistence.service.DealLedgerService;
import com.rental.settlement.persistence.service.PaymentLedgerService;
import com.rental.settlement.persistence.service.PaymentLedgerService.Transition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Settles the success fee of completed deals against the payment gateway: opens gateway
 * orders, verifies checkout callbacks and exposes the payment history of a deal.
 * <p>
 * Gateway calls happen before any ledger write and outside transactions. A failed call
 * leaves the ledger untouched.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentReconciliationEngine {

    private static final BigDecimal MINOR_UNITS = BigDecimal.valueOf(100);

    private final DealLedgerService dealLedger;
    private final PaymentLedgerService paymentLedger;
    private final PaymentGatewayAdapter gatewayAdapter;
    private final GatewayCallExecutor gatewayCallExecutor;
    private final GatewaySignatureVerifier signatureVerifier;
    private final UserDirectory userDirectory;
    private final PaymentEventProducer eventProducer;
    private final SettlementAuditLogger auditLogger;
    private final GatewayProperties gatewayProperties;
    private final ObjectMapper objectMapper;

    /**
     * Opens a gateway order for the success fee of a completed deal and records the payment
     * as INITIATED. Calling again for an unpaid deal replaces the order.
     *
     * @throws ResourceNotFoundException   when the deal is absent or the payer is not one of its parties
     * @throws InvalidStateException       when the deal is not completed, already paid, or its payment was refunded
     * @throws GatewayUnavailableException when the gateway fails or times out
     */
    public PaymentOrder createOrder(OrderRequest request) {
        DealView deal = dealLedger.findDeal(request.getDealId())
                .filter(d -> d.involves(request.getPayerId()))
                .orElseThrow(() -> new ResourceNotFoundException(ResourceNotFoundException.DEAL_NOT_FOUND, "Deal not found"));
        if (deal.getStatus() != DealStatus.COMPLETED) {
            throw new InvalidStateException(InvalidStateException.INVALID_DEAL_STATUS,
                    "Deal must be completed before processing payment");
        }
        paymentLedger.findByDealId(deal.getId())
                .ifPresent(existing -> PaymentLedgerService.ensureOrderable(existing.getStatus()));

        long amountMinor = toMinorUnits(request.getAmount());
        String currency = gatewayProperties.getCurrency();
        String receipt = "deal_" + deal.getId() + "_" + System.currentTimeMillis();
        Map<String, String> notes = gatewayNotes(deal);

        log.info("Creating gateway order: dealId={} amountMinor={} gateway={}", deal.getId(), amountMinor, gatewayAdapter.getGatewayName());
        RemoteOrder order = gatewayCallExecutor.execute(gatewayAdapter.getGatewayName(), "createOrder",
                () -> gatewayAdapter.createRemoteOrder(amountMinor, currency, receipt, notes));

        PaymentRecord payment = paymentLedger.recordOrder(request, order, payerNotes(request));
        eventProducer.publish(PaymentEventName.PAYMENT_INITIATED, payment);

        return PaymentOrder.builder()
                .dealId(deal.getId())
                .orderId(order.getOrderId())
                .amount(request.getAmount())
                .amountInMinor(amountMinor)
                .currency(order.getCurrency() != null ? order.getCurrency() : currency)
                .receipt(order.getReceipt() != null ? order.getReceipt() : receipt)
                .build();
    }

    static long toMinorUnits(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("amount must be positive");
        }
        return amount.multiply(MINOR_UNITS).setScale(0, RoundingMode.HALF_UP).longValueExact();
    }

    private Map<String, String> gatewayNotes(DealView deal) {
        Map<String, String> notes = new LinkedHashMap<>();
        notes.put("dealId", deal.getId());
        notes.put("propertyId", deal.getPropertyId());
        notes.put("tenantName", userDirectory.findUser(deal.getTenantId()).map(PartySummary::getFullName).orElse(""));
        notes.put("ownerName", userDirectory.findUser(deal.getOwnerId()).map(PartySummary::getFullName).orElse(""));
        return notes;
    }

    private String payerNotes(OrderRequest request) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("userName", request.getUserName());
        node.put("email", request.getEmail());
        node.put("phone", request.getPhone());
        return node.toString();
    }

    /**
     * Verifies the checkout callback of a payment and captures it. Verifying the same payment
     * twice, or after the capture webhook already arrived, returns the completed payment.
     *
     * @throws ResourceNotFoundException      when the deal has no payment
     * @throws SignatureVerificationException when the signature does not match
     * @throws InvalidStateException          when the order id is not the deal's current order or the
     *                                        payment can no longer be captured
     */
    public PaymentRecord verifyPayment(VerificationRequest request) {
        PaymentRecord payment = paymentLedger.findByDealId(request.getDealId())
                .orElseThrow(() -> new ResourceNotFoundException(ResourceNotFoundException.PAYMENT_NOT_FOUND, "Payment record not found"));

        if (!Objects.equals(payment.getExternalOrderId(), request.getExternalOrderId())) {
            throw new InvalidStateException(InvalidStateException.ORDER_ID_MISMATCH, "Order ID mismatch");
        }

        if (!signatureVerifier.verifyPaymentSignature(request.getExternalOrderId(), request.getExternalPaymentId(), request.getSignature())) {
            paymentLedger.recordSignatureFailure(payment.getId(), request.getExternalOrderId(), request.getExternalPaymentId());
            auditLogger.paymentSignatureRejected(payment.getDealId(), payment.getId(),
                    request.getExternalOrderId(), request.getExternalPaymentId());
            throw new SignatureVerificationException(SignatureVerificationException.INVALID_SIGNATURE, "Invalid payment signature");
        }

        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("orderId", request.getExternalOrderId());
        payload.put("paymentId", request.getExternalPaymentId());
        payload.put("source", "checkout");

        Transition transition = paymentLedger.applyCapture(payment.getId(), request.getExternalPaymentId(),
                request.getSignature(), null, payload.toString());
        PaymentRecord current = transition.getPayment();
        if (transition.isApplied()) {
            auditLogger.paymentCompleted(current.getDealId(), current.getId(), current.getExternalPaymentId(), "checkout");
            eventProducer.publish(PaymentEventName.PAYMENT_COMPLETED, current);
            return current;
        }
        if (current.getStatus() == PaymentStatus.COMPLETED) {
            log.info("Payment already completed, verification is a no-op: paymentId={}", current.getId());
            return current;
        }
        throw new InvalidStateException(InvalidStateException.INVALID_PAYMENT_STATUS,
                "Payment is " + current.getStatus() + " and cannot be completed");
    }

    /**
     * The payment of a deal with its events, newest first. Empty when there is no payment or
     * the requester is neither a party of the deal nor an admin.
     */
    public Optional<PaymentDetails> getPaymentDetails(String dealId, ActingUser requester) {
        Optional<DealView> deal = dealLedger.findDeal(dealId);
        if (deal.isEmpty() || !(requester.isAdmin() || deal.get().involves(requester.getUserId()))) {
            return Optional.empty();
        }
        return paymentLedger.findByDealId(dealId)
                .map(payment -> PaymentDetails.builder()
                        .payment(payment)
                        .events(paymentLedger.findEvents(payment.getId()))
                        .build());
    }
}
