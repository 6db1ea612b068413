package com.rental.settlement.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Payment gateway settings ({@code rental.gateway.*}). Secrets are expected from the
 * environment, never from the packaged configuration.
 */
@Data
@ConfigurationProperties(prefix = "rental.gateway")
public class GatewayProperties {

    /** {@code mock} (default) or {@code razorpay}. */
    private String provider = "mock";

    private String baseUrl = "https://api.razorpay.com/v1";

    /** Public key id, also the basic-auth user for the REST API. */
    private String keyId;

    /** Shared secret: basic-auth password and HMAC key of the checkout signature. */
    private String keySecret;

    /** HMAC key of webhook deliveries; distinct from {@link #keySecret}. */
    private String webhookSecret;

    private String currency = "INR";

    private Duration connectTimeout = Duration.ofSeconds(2);

    private Duration readTimeout = Duration.ofSeconds(4);
}
