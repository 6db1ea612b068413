package com.rental.settlement.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Outbound notification settings ({@code rental.notifications.*}).
 */
@Data
@ConfigurationProperties(prefix = "rental.notifications")
public class NotificationProperties {

    /** Topic consumed by the mailer service. */
    private String topic = "email-notifications";

    private Kafka kafka = new Kafka();

    @Data
    public static class Kafka {
        /** When false, notifications are only logged. */
        private boolean enabled = true;
    }
}
