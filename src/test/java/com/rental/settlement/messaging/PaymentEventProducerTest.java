package com.rental.settlement.messaging;

import com.rental.settlement.domain.PaymentEventName;
import com.rental.settlement.domain.PaymentRecord;
import com.rental.settlement.domain.PaymentStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PaymentEventProducerTest {

    @Mock
    private KafkaTemplate<String, Object> kafkaTemplate;

    private PaymentEventProducer producer;

    private final PaymentRecord payment = PaymentRecord.builder()
            .id("payment-1")
            .dealId("deal-1")
            .amount(49_900)
            .currency("INR")
            .externalOrderId("order_1")
            .externalPaymentId("pay_1")
            .status(PaymentStatus.COMPLETED)
            .build();

    @BeforeEach
    void setUp() {
        producer = new PaymentEventProducer(kafkaTemplate);
        ReflectionTestUtils.setField(producer, "topic", "payment-events");
    }

    @Test
    void publishesLifecycleEventKeyedByDeal() {
        when(kafkaTemplate.send(eq("payment-events"), eq("deal-1"), any())).thenReturn(new CompletableFuture<>());

        producer.publish(PaymentEventName.PAYMENT_COMPLETED, payment);

        ArgumentCaptor<Object> event = ArgumentCaptor.forClass(Object.class);
        verify(kafkaTemplate).send(eq("payment-events"), eq("deal-1"), event.capture());
        PaymentLifecycleEvent sent = (PaymentLifecycleEvent) event.getValue();
        assertThat(sent.getEventType()).isEqualTo("PAYMENT_COMPLETED");
        assertThat(sent.getPaymentId()).isEqualTo("payment-1");
        assertThat(sent.getAmount()).isEqualTo(49_900L);
        assertThat(sent.getStatus()).isEqualTo(PaymentStatus.COMPLETED);
    }

    @Test
    void producerFailureNeverReachesCaller() {
        when(kafkaTemplate.send(any(), any(), any())).thenThrow(new IllegalStateException("metadata timeout"));

        assertThatCode(() -> producer.publish(PaymentEventName.REFUND_INITIATED, payment)).doesNotThrowAnyException();
    }
}
