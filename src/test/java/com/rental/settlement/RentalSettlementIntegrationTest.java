package com.rental.settlement;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rental.settlement.core.GatewaySignatures;
import com.rental.settlement.domain.PropertyStatus;
import com.rental.settlement.domain.UserRole;
import com.rental.settlement.persistence.entity.ConversationEntity;
import com.rental.settlement.persistence.entity.PropertyEntity;
import com.rental.settlement.persistence.entity.UserEntity;
import com.rental.settlement.persistence.repository.ConversationRepository;
import com.rental.settlement.persistence.repository.PropertyRepository;
import com.rental.settlement.persistence.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.kafka.test.context.EmbeddedKafka;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.RequestPostProcessor;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * End-to-end flow: two-sided confirmation, order, checkout verification, a replayed capture
 * webhook, then an admin refund settled by the refund webhook. Uses Embedded Kafka and
 * Testcontainers Redis; skipped when Docker is unavailable.
 * Run with: mvn test -Dexcluded.groups= -Dgroups=integration
 */
@Tag("integration")
@SpringBootTest(classes = RentalSettlementApplication.class, properties = "rental.notifications.kafka.enabled=true")
@AutoConfigureMockMvc
@EmbeddedKafka(partitions = 1, topics = {"payment-events", "email-notifications"},
        bootstrapServersProperty = "spring.kafka.bootstrap-servers")
@Testcontainers(disabledWithoutDocker = true)
class RentalSettlementIntegrationTest {

    @Container
    static GenericContainer<?> redis = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    @DynamicPropertySource
    static void redisProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.redis.host", redis::getHost);
        registry.add("spring.data.redis.port", () -> redis.getMappedPort(6379).toString());
    }

    @Autowired private MockMvc mockMvc;
    @Autowired private ObjectMapper objectMapper;
    @Value("${rental.gateway.key-secret}") private String keySecret;
    @Value("${rental.gateway.webhook-secret}") private String webhookSecret;
    @Autowired private UserRepository userRepository;
    @Autowired private PropertyRepository propertyRepository;
    @Autowired private ConversationRepository conversationRepository;

    @BeforeEach
    void seed() {
        userRepository.save(UserEntity.builder().id("owner-1").firstName("Asha").lastName("Rao")
                .email("asha@example.com").role(UserRole.OWNER).build());
        userRepository.save(UserEntity.builder().id("tenant-1").firstName("Vikram").lastName("Shah")
                .email("vikram@example.com").role(UserRole.TENANT).build());
        propertyRepository.save(PropertyEntity.builder().id("prop-1").title("2BHK in Indiranagar")
                .city("Bengaluru").rentAmount(18_000).status(PropertyStatus.AVAILABLE).build());
        conversationRepository.save(ConversationEntity.builder().id("conv-1").propertyId("prop-1")
                .ownerId("owner-1").tenantId("tenant-1").createdAt(Instant.now()).build());
    }

    private static RequestPostProcessor user(String userId, String role) {
        return jwt().jwt(j -> j.subject(userId).claim("role", role))
                .authorities(new SimpleGrantedAuthority("ROLE_" + role));
    }

    @Test
    @DisplayName("Both confirmations complete the deal, the success fee settles once and a refund settles by webhook")
    void dealConfirmationAndSettlement() throws Exception {
        mockMvc.perform(post("/api/v1/deals/conversations/conv-1/owner-confirm").with(user("owner-1", "OWNER")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PENDING_TENANT"));

        String dealJson = mockMvc.perform(post("/api/v1/deals/conversations/conv-1/tenant-confirm").with(user("tenant-1", "TENANT")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.successFeeAmount").value(499))
                .andReturn().getResponse().getContentAsString();
        String dealId = objectMapper.readTree(dealJson).path("id").asText();

        String orderJson = mockMvc.perform(post("/api/v1/payments/orders")
                        .with(user("tenant-1", "TENANT"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dealId\":\"" + dealId + "\",\"amount\":499,\"phone\":\"9876543210\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.amountInMinor").value(49900))
                .andReturn().getResponse().getContentAsString();
        String orderId = objectMapper.readTree(orderJson).path("orderId").asText();

        String signature = GatewaySignatures.payment(keySecret, orderId, "pay_int_1");
        mockMvc.perform(post("/api/v1/payments/verify")
                        .with(user("tenant-1", "TENANT"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"orderId\":\"" + orderId + "\",\"paymentId\":\"pay_int_1\",\"signature\":\""
                                + signature + "\",\"dealId\":\"" + dealId + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETED"));

        String webhook = "{\"event\":\"payment.captured\",\"payload\":{\"payment\":{\"entity\":"
                + "{\"id\":\"pay_int_1\",\"order_id\":\"" + orderId + "\",\"method\":\"upi\"}}}}";
        for (int i = 0; i < 2; i++) {
            mockMvc.perform(post("/api/v1/payments/webhook")
                            .contentType(MediaType.APPLICATION_JSON)
                            .header("X-Razorpay-Signature", GatewaySignatures.webhook(webhookSecret, webhook))
                            .header("X-Razorpay-Event-Id", "evt_int_1")
                            .content(webhook))
                    .andExpect(status().isOk());
        }

        String detailsJson = mockMvc.perform(get("/api/v1/payments/deals/" + dealId).with(user("owner-1", "OWNER")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.payment.status").value("COMPLETED"))
                .andReturn().getResponse().getContentAsString();
        assertThat(countEvents(detailsJson, "PAYMENT_COMPLETED")).isEqualTo(1);

        mockMvc.perform(post("/api/v1/payments/deals/" + dealId + "/refund")
                        .with(user("admin-1", "SUPER_ADMIN"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"tenant backed out\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.externalRefundId").isNotEmpty())
                .andExpect(jsonPath("$.paymentStatus").value("COMPLETED"));

        mockMvc.perform(post("/api/v1/payments/deals/" + dealId + "/refund").with(user("admin-1", "SUPER_ADMIN")))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("REFUND_IN_PROGRESS"));

        String refundWebhook = "{\"event\":\"refund.processed\",\"payload\":{\"refund\":{\"entity\":"
                + "{\"id\":\"rfnd_int_1\",\"payment_id\":\"pay_int_1\",\"amount\":49900}}}}";
        mockMvc.perform(post("/api/v1/payments/webhook")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Razorpay-Signature", GatewaySignatures.webhook(webhookSecret, refundWebhook))
                        .header("X-Razorpay-Event-Id", "evt_int_2")
                        .content(refundWebhook))
                .andExpect(status().isOk());

        String refundedJson = mockMvc.perform(get("/api/v1/payments/deals/" + dealId).with(user("tenant-1", "TENANT")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.payment.status").value("REFUNDED"))
                .andReturn().getResponse().getContentAsString();
        assertThat(countEvents(refundedJson, "REFUND_INITIATED")).isEqualTo(1);
        assertThat(countEvents(refundedJson, "REFUND_COMPLETED")).isEqualTo(1);
    }

    private long countEvents(String detailsJson, String eventName) throws Exception {
        long count = 0;
        for (JsonNode event : objectMapper.readTree(detailsJson).path("events")) {
            if (eventName.equals(event.path("eventName").asText())) {
                count++;
            }
        }
        return count;
    }
}
