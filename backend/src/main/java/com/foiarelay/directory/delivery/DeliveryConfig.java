package com.foiarelay.directory.delivery;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Fallback collaborators used until a real mail transport or portal driver is wired in.
 * Both fail every call, which surfaces as a manual-submission outcome.
 */
@Configuration
public class DeliveryConfig {

    @Bean
    @ConditionalOnMissingBean(MailDispatcher.class)
    public MailDispatcher mailDispatcher() {
        return payload -> {
            throw new DeliveryException("Email service not configured");
        };
    }

    @Bean
    @ConditionalOnMissingBean(PortalAutomation.class)
    public PortalAutomation portalAutomation() {
        return manifest -> {
            throw new DeliveryException("Portal automation not configured");
        };
    }
}
