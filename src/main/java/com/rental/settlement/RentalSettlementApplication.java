package com.rental.settlement;

import com.rental.settlement.config.GatewayProperties;
import com.rental.settlement.config.NotificationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Deal confirmation and success-fee settlement for the rental marketplace.
 */
@SpringBootApplication
@EnableConfigurationProperties({GatewayProperties.class, NotificationProperties.class})
public class RentalSettlementApplication {

    public static void main(String[] args) {
        SpringApplication.run(RentalSettlementApplication.class, args);
    }
}
