package com.rental.settlement.api;

import com.rental.settlement.core.PaymentReconciliationEngine;
import com.rental.settlement.core.RefundOrchestrator;
import com.rental.settlement.core.WebhookProcessor;
import com.rental.settlement.domain.OrderRequest;
import com.rental.settlement.domain.PaymentDetails;
import com.rental.settlement.domain.PaymentOrder;
import com.rental.settlement.domain.PaymentRecord;
import com.rental.settlement.domain.RefundReceipt;
import com.rental.settlement.domain.VerificationRequest;
import com.rental.settlement.domain.WebhookOutcome;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST API for success-fee payments: order creation, checkout verification, refunds and the
 * gateway webhook.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/payments")
@RequiredArgsConstructor
@Tag(name = "Payments", description = "Settle the success fee of completed deals")
public class PaymentController {

    static final String SIGNATURE_HEADER = "X-Razorpay-Signature";
    static final String EVENT_ID_HEADER = "X-Razorpay-Event-Id";

    private final PaymentReconciliationEngine reconciliationEngine;
    private final RefundOrchestrator refundOrchestrator;
    private final WebhookProcessor webhookProcessor;

    @PostMapping("/orders")
    @Operation(summary = "Create payment order",
            description = "Opens a gateway order for the success fee of a completed deal. amount is in rupees. "
                    + "Calling again before payment replaces the order.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Order created; pass orderId to the gateway checkout",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = PaymentOrder.class))),
            @ApiResponse(responseCode = "400", description = "Validation failed, deal not completed (INVALID_DEAL_STATUS) or payment refunded (INVALID_PAYMENT_STATUS)"),
            @ApiResponse(responseCode = "404", description = "Deal not found for this user (DEAL_NOT_FOUND)"),
            @ApiResponse(responseCode = "400", description = "Deal already paid (PAYMENT_ALREADY_COMPLETED)"),
            @ApiResponse(responseCode = "503", description = "Gateway unavailable (GATEWAY_UNAVAILABLE). Retry later.")
    })
    public ResponseEntity<PaymentOrder> createOrder(@Valid @RequestBody CreateOrderRequestDto dto, @AuthenticationPrincipal Jwt jwt) {
        OrderRequest request = OrderRequest.builder()
                .dealId(dto.getDealId())
                .amount(dto.getAmount())
                .description(dto.getDescription())
                .payerId(jwt.getSubject())
                .email(dto.getEmail())
                .phone(dto.getPhone())
                .userName(dto.getUserName())
                .build();
        return ResponseEntity.ok(reconciliationEngine.createOrder(request));
    }

    @PostMapping("/verify")
    @Operation(summary = "Verify checkout payment",
            description = "Checks the gateway signature over orderId|paymentId and captures the payment. Repeated calls return the completed payment.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Payment completed",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = PaymentRecord.class))),
            @ApiResponse(responseCode = "400", description = "Invalid signature (INVALID_SIGNATURE) or payment not capturable (INVALID_PAYMENT_STATUS)"),
            @ApiResponse(responseCode = "404", description = "No payment for this deal (PAYMENT_NOT_FOUND)"),
            @ApiResponse(responseCode = "400", description = "orderId is not the deal's current order (ORDER_ID_MISMATCH)")
    })
    public ResponseEntity<PaymentRecord> verify(@Valid @RequestBody VerifyPaymentRequestDto dto) {
        VerificationRequest request = VerificationRequest.builder()
                .externalOrderId(dto.getOrderId())
                .externalPaymentId(dto.getPaymentId())
                .signature(dto.getSignature())
                .dealId(dto.getDealId())
                .build();
        return ResponseEntity.ok(reconciliationEngine.verifyPayment(request));
    }

    @GetMapping("/deals/{dealId}")
    @Operation(summary = "Payment details of a deal",
            description = "Payment and its event history, newest first. 200 with an empty body when there is no payment "
                    + "or the caller is neither a party of the deal nor an admin.")
    public ResponseEntity<PaymentDetails> getPaymentDetails(@PathVariable String dealId, @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(reconciliationEngine.getPaymentDetails(dealId, AuthenticatedUsers.from(jwt)).orElse(null));
    }

    @PostMapping("/deals/{dealId}/refund")
    @PreAuthorize("hasRole('SUPER_ADMIN')")
    @Operation(summary = "Refund a payment",
            description = "Full refund of the deal's captured payment. The payment stays COMPLETED until the gateway confirms the refund.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Refund initiated",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = RefundReceipt.class))),
            @ApiResponse(responseCode = "400", description = "Payment not completed (INVALID_PAYMENT_STATUS)"),
            @ApiResponse(responseCode = "403", description = "Caller is not an admin"),
            @ApiResponse(responseCode = "404", description = "No captured payment (PAYMENT_NOT_FOUND)"),
            @ApiResponse(responseCode = "409", description = "Refund already in progress (REFUND_IN_PROGRESS)"),
            @ApiResponse(responseCode = "503", description = "Gateway unavailable (GATEWAY_UNAVAILABLE)")
    })
    public ResponseEntity<RefundReceipt> refund(@PathVariable String dealId,
                                                @Valid @RequestBody(required = false) RefundRequestDto dto,
                                                @AuthenticationPrincipal Jwt jwt) {
        String reason = dto != null ? dto.getReason() : null;
        return ResponseEntity.ok(refundOrchestrator.refund(dealId, reason, AuthenticatedUsers.from(jwt)));
    }

    @PostMapping("/webhook")
    @Operation(summary = "Gateway webhook",
            description = "Authenticated by HMAC-SHA256 of the raw body. Always acknowledged with 200 so the gateway does not retry "
                    + "deliveries that can never succeed; rejected and failed deliveries are logged.")
    public ResponseEntity<Map<String, Object>> webhook(@RequestBody(required = false) String rawBody,
                                                       @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature,
                                                       @RequestHeader(value = EVENT_ID_HEADER, required = false) String eventId) {
        try {
            WebhookOutcome outcome = webhookProcessor.process(rawBody, signature, eventId);
            log.debug("Webhook eventId={} outcome={}", eventId, outcome);
        } catch (SignatureVerificationException e) {
            log.warn("Webhook rejected: eventId={} reason={}", eventId, e.getMessage());
        } catch (Exception e) {
            log.error("Webhook processing failed: eventId={}", eventId, e);
        }
        return ResponseEntity.ok(Map.of("received", true));
    }
}
