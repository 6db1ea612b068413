package com.rental.settlement.adapters;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rental.settlement.config.GatewayProperties;
import com.rental.settlement.core.GatewayException;
import com.rental.settlement.core.PaymentGatewayAdapter;
import com.rental.settlement.domain.RemoteOrder;
import com.rental.settlement.domain.RemoteRefund;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Razorpay REST integration (orders and refunds). Authenticates with basic auth using the key
 * id and key secret; checkout and webhook signatures are verified elsewhere.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "rental.gateway.provider", havingValue = "razorpay")
public class RazorpayGatewayAdapter implements PaymentGatewayAdapter {

    /** Razorpay rejects longer receipts. */
    static final int MAX_RECEIPT_LENGTH = 40;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    public RazorpayGatewayAdapter(RestTemplateBuilder builder, GatewayProperties properties, ObjectMapper objectMapper) {
        if (properties.getKeyId() == null || properties.getKeySecret() == null) {
            throw new IllegalStateException("rental.gateway.key-id and rental.gateway.key-secret are required for the razorpay provider");
        }
        this.restTemplate = builder
                .rootUri(properties.getBaseUrl())
                .basicAuthentication(properties.getKeyId(), properties.getKeySecret())
                .connectTimeout(properties.getConnectTimeout())
                .readTimeout(properties.getReadTimeout())
                .build();
        this.objectMapper = objectMapper;
        log.info("Razorpay gateway adapter configured: baseUrl={} keyId={}", properties.getBaseUrl(), properties.getKeyId());
    }

    @Override
    public String getGatewayName() {
        return "razorpay";
    }

    @Override
    public RemoteOrder createRemoteOrder(long amountMinor, String currency, String receipt, Map<String, String> notes) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("amount", amountMinor);
        body.put("currency", currency);
        body.put("receipt", receipt.length() > MAX_RECEIPT_LENGTH ? receipt.substring(0, MAX_RECEIPT_LENGTH) : receipt);
        body.put("payment_capture", true);
        body.put("notes", notes);

        String raw = post("/orders", body);
        JsonNode order = readTree(raw);
        return RemoteOrder.builder()
                .orderId(order.path("id").asText(null))
                .amountMinor(order.path("amount").asLong(amountMinor))
                .currency(order.path("currency").asText(currency))
                .receipt(order.path("receipt").asText(receipt))
                .rawPayload(raw)
                .build();
    }

    @Override
    public RemoteRefund refund(String externalPaymentId, long amountMinor, Map<String, String> notes) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("amount", amountMinor);
        body.put("notes", notes);

        String raw = post("/payments/" + externalPaymentId + "/refund", body);
        JsonNode refund = readTree(raw);
        return RemoteRefund.builder()
                .refundId(refund.path("id").asText(null))
                .amountMinor(refund.path("amount").asLong(amountMinor))
                .rawPayload(raw)
                .build();
    }

    private String post(String path, Map<String, Object> body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            String response = restTemplate.postForObject(path, new HttpEntity<>(body, headers), String.class);
            if (response == null || response.isBlank()) {
                throw new GatewayException("Empty response from Razorpay " + path);
            }
            return response;
        } catch (RestClientResponseException e) {
            log.warn("Razorpay {} returned {}: {}", path, e.getStatusCode().value(), errorDescription(e.getResponseBodyAsString()));
            throw new GatewayException("Razorpay " + path + " failed with status " + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new GatewayException("Razorpay " + path + " unreachable: " + e.getMessage(), e);
        }
    }

    private JsonNode readTree(String raw) {
        try {
            JsonNode node = objectMapper.readTree(raw);
            if (node.path("id").isMissingNode()) {
                throw new GatewayException("Razorpay response has no id");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new GatewayException("Unreadable Razorpay response", e);
        }
    }

    private String errorDescription(String body) {
        try {
            return objectMapper.readTree(body).path("error").path("description").asText(body);
        } catch (JsonProcessingException e) {
            return body;
        }
    }
}
