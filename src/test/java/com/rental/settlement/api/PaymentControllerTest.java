package com.rental.settlement.api;

import com.rental.settlement.config.SecurityConfig;
import com.rental.settlement.core.PaymentReconciliationEngine;
import com.rental.settlement.core.RefundOrchestrator;
import com.rental.settlement.core.WebhookProcessor;
import com.rental.settlement.domain.ActingUser;
import com.rental.settlement.domain.OrderRequest;
import com.rental.settlement.domain.PaymentOrder;
import com.rental.settlement.domain.PaymentRecord;
import com.rental.settlement.domain.PaymentStatus;
import com.rental.settlement.domain.RefundReceipt;
import com.rental.settlement.domain.UserRole;
import com.rental.settlement.domain.WebhookOutcome;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.RequestPostProcessor;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = PaymentController.class)
@Import(SecurityConfig.class)
class PaymentControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private PaymentReconciliationEngine reconciliationEngine;

    @MockitoBean
    private RefundOrchestrator refundOrchestrator;

    @MockitoBean
    private WebhookProcessor webhookProcessor;

    private static RequestPostProcessor user(String userId, String role) {
        return jwt().jwt(j -> j.subject(userId).claim("role", role))
                .authorities(new SimpleGrantedAuthority("ROLE_" + role));
    }

    @Test
    void createOrderUsesTokenSubjectAsPayer() throws Exception {
        when(reconciliationEngine.createOrder(any())).thenReturn(PaymentOrder.builder()
                .dealId("deal-1")
                .orderId("order_1")
                .amount(new BigDecimal("499"))
                .amountInMinor(49_900)
                .currency("INR")
                .receipt("deal_deal-1_1")
                .build());

        mockMvc.perform(post("/api/v1/payments/orders")
                        .with(user("tenant-1", "TENANT"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "dealId": "deal-1",
                                  "amount": 499,
                                  "phone": "9876543210",
                                  "email": "vikram@example.com",
                                  "userName": "Vikram"
                                }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.orderId").value("order_1"))
                .andExpect(jsonPath("$.amountInMinor").value(49900))
                .andExpect(jsonPath("$.currency").value("INR"));

        ArgumentCaptor<OrderRequest> request = ArgumentCaptor.forClass(OrderRequest.class);
        verify(reconciliationEngine).createOrder(request.capture());
        assertThat(request.getValue().getPayerId()).isEqualTo("tenant-1");
        assertThat(request.getValue().getPhone()).isEqualTo("9876543210");
    }

    @Test
    void createOrderRejectsInvalidPhone() throws Exception {
        mockMvc.perform(post("/api/v1/payments/orders")
                        .with(user("tenant-1", "TENANT"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "dealId": "deal-1", "amount": 499, "phone": "12345" }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.details.phone").exists());
        verify(reconciliationEngine, never()).createOrder(any());
    }

    @Test
    void paidDealIsBadRequest() throws Exception {
        when(reconciliationEngine.createOrder(any()))
                .thenThrow(new InvalidStateException(InvalidStateException.PAYMENT_ALREADY_COMPLETED, "Payment already completed for this deal"));

        mockMvc.perform(post("/api/v1/payments/orders")
                        .with(user("tenant-1", "TENANT"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "dealId": "deal-1", "amount": 499, "phone": "9876543210" }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("PAYMENT_ALREADY_COMPLETED"));
    }

    @Test
    void gatewayOutageIsServiceUnavailable() throws Exception {
        when(reconciliationEngine.createOrder(any()))
                .thenThrow(new GatewayUnavailableException("Payment gateway did not respond in time. Retry later."));

        mockMvc.perform(post("/api/v1/payments/orders")
                        .with(user("tenant-1", "TENANT"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "dealId": "deal-1", "amount": 499, "phone": "9876543210" }
                                """))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("GATEWAY_UNAVAILABLE"));
    }

    @Test
    void verifyRejectsBadSignature() throws Exception {
        when(reconciliationEngine.verifyPayment(any()))
                .thenThrow(new SignatureVerificationException(SignatureVerificationException.INVALID_SIGNATURE, "Invalid payment signature"));

        mockMvc.perform(post("/api/v1/payments/verify")
                        .with(user("tenant-1", "TENANT"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "orderId": "order_1", "paymentId": "pay_1", "signature": "bad", "dealId": "deal-1" }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_SIGNATURE"));
    }

    @Test
    void verifyRejectsStaleOrderId() throws Exception {
        when(reconciliationEngine.verifyPayment(any()))
                .thenThrow(new InvalidStateException(InvalidStateException.ORDER_ID_MISMATCH, "Order ID mismatch"));

        mockMvc.perform(post("/api/v1/payments/verify")
                        .with(user("tenant-1", "TENANT"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "orderId": "order_old", "paymentId": "pay_1", "signature": "abc", "dealId": "deal-1" }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("ORDER_ID_MISMATCH"));
    }

    @Test
    void verifyReturnsCompletedPayment() throws Exception {
        when(reconciliationEngine.verifyPayment(any())).thenReturn(PaymentRecord.builder()
                .id("payment-1")
                .dealId("deal-1")
                .amount(49_900)
                .currency("INR")
                .status(PaymentStatus.COMPLETED)
                .build());

        mockMvc.perform(post("/api/v1/payments/verify")
                        .with(user("tenant-1", "TENANT"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "orderId": "order_1", "paymentId": "pay_1", "signature": "abc", "dealId": "deal-1" }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETED"));
    }

    @Test
    void refundRequiresAdminRole() throws Exception {
        mockMvc.perform(post("/api/v1/payments/deals/deal-1/refund").with(user("owner-1", "OWNER")))
                .andExpect(status().isForbidden());
        verify(refundOrchestrator, never()).refund(any(), any(), any());
    }

    @Test
    void adminRefundPassesReasonAndRequester() throws Exception {
        when(refundOrchestrator.refund(eq("deal-1"), eq("tenant backed out"), any())).thenReturn(RefundReceipt.builder()
                .dealId("deal-1")
                .paymentId("payment-1")
                .externalRefundId("rfnd_1")
                .amount(49_900)
                .currency("INR")
                .paymentStatus(PaymentStatus.COMPLETED)
                .reason("tenant backed out")
                .build());

        mockMvc.perform(post("/api/v1/payments/deals/deal-1/refund")
                        .with(user("admin-1", "SUPER_ADMIN"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\": \"tenant backed out\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.externalRefundId").value("rfnd_1"));

        ArgumentCaptor<ActingUser> requester = ArgumentCaptor.forClass(ActingUser.class);
        verify(refundOrchestrator).refund(eq("deal-1"), eq("tenant backed out"), requester.capture());
        assertThat(requester.getValue().getUserId()).isEqualTo("admin-1");
        assertThat(requester.getValue().getRole()).isEqualTo(UserRole.SUPER_ADMIN);
    }

    @Test
    void webhookNeedsNoTokenAndPassesRawBody() throws Exception {
        String body = "{\"event\":\"payment.captured\",\"payload\":{}}";
        when(webhookProcessor.process(body, "sig", "evt_1")).thenReturn(WebhookOutcome.APPLIED);

        mockMvc.perform(post("/api/v1/payments/webhook")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header(PaymentController.SIGNATURE_HEADER, "sig")
                        .header(PaymentController.EVENT_ID_HEADER, "evt_1")
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.received").value(true));
        verify(webhookProcessor).process(body, "sig", "evt_1");
    }

    @Test
    void webhookIsAcknowledgedEvenWhenRejected() throws Exception {
        when(webhookProcessor.process(any(), any(), any()))
                .thenThrow(new SignatureVerificationException(SignatureVerificationException.INVALID_WEBHOOK_SIGNATURE, "Invalid webhook signature"));

        mockMvc.perform(post("/api/v1/payments/webhook")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.received").value(true));
    }

    @Test
    void webhookIsAcknowledgedWhenProcessingFails() throws Exception {
        when(webhookProcessor.process(any(), any(), any())).thenThrow(new IllegalStateException("database down"));

        mockMvc.perform(post("/api/v1/payments/webhook")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isOk());
    }
}
