package com.rental.settlement.messaging;

import com.rental.settlement.config.NotificationProperties;
import com.rental.settlement.domain.NotificationKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class KafkaNotifierTest {

    @Mock
    private KafkaTemplate<String, Object> kafkaTemplate;

    private KafkaNotifier notifier;

    @BeforeEach
    void setUp() {
        NotificationProperties properties = new NotificationProperties();
        properties.setTopic("email-notifications");
        notifier = new KafkaNotifier(kafkaTemplate, properties);
    }

    @Test
    void publishesMessageKeyedByUserId() {
        CompletableFuture<SendResult<String, Object>> pending = new CompletableFuture<>();
        when(kafkaTemplate.send(eq("email-notifications"), eq("tenant-1"), any())).thenReturn(pending);

        NotificationOutcome outcome = notifier.notify(NotificationKind.DEAL_CREATED, "vikram@example.com", "Vikram",
                Map.of("dealId", "deal-1"), "tenant-1");

        assertThat(outcome).isEqualTo(NotificationOutcome.QUEUED);
        ArgumentCaptor<Object> message = ArgumentCaptor.forClass(Object.class);
        verify(kafkaTemplate).send(eq("email-notifications"), eq("tenant-1"), message.capture());
        NotificationMessage sent = (NotificationMessage) message.getValue();
        assertThat(sent.getKind()).isEqualTo(NotificationKind.DEAL_CREATED);
        assertThat(sent.getRecipientEmail()).isEqualTo("vikram@example.com");
        assertThat(sent.getData()).containsEntry("dealId", "deal-1");
        assertThat(sent.getMessageId()).isNotBlank();
    }

    @Test
    void brokerFailureAfterSendIsOnlyLogged() {
        CompletableFuture<SendResult<String, Object>> failed = new CompletableFuture<>();
        failed.completeExceptionally(new IllegalStateException("broker down"));
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenReturn(failed);

        NotificationOutcome outcome = notifier.notify(NotificationKind.DEAL_COMPLETED, "asha@example.com", "Asha",
                Map.of(), "owner-1");

        assertThat(outcome).isEqualTo(NotificationOutcome.QUEUED);
    }

    @Test
    void recipientWithoutEmailIsSkipped() {
        NotificationOutcome outcome = notifier.notify(NotificationKind.DEAL_CREATED, " ", "Asha", Map.of(), "owner-1");

        assertThat(outcome).isEqualTo(NotificationOutcome.SKIPPED);
        verify(kafkaTemplate, never()).send(anyString(), anyString(), any());
    }
}
