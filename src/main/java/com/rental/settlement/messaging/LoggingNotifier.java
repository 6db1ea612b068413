package com.rental.settlement.messaging;

import com.rental.settlement.domain.NotificationKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Used when the Kafka channel is switched off (local runs without a broker).
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "rental.notifications.kafka.enabled", havingValue = "false")
public class LoggingNotifier implements Notifier {

    @Override
    public NotificationOutcome notify(NotificationKind kind, String recipientEmail, String recipientName,
                                      Map<String, Object> data, String userIdForLogging) {
        log.info("Notification {} for userId={} recipient={} data={}", kind, userIdForLogging, recipientName, data);
        return NotificationOutcome.LOGGED;
    }
}
