package com.esplanada.api.config;

import com.esplanada.client.identity.IdentityFingerprintGenerator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Server-side identity derivation for clients that post their raw signals.
 */
@Configuration
public class IdentityConfig {

    @Bean
    public IdentityFingerprintGenerator identityFingerprintGenerator(
            Clock clock,
            @Value("${esplanada.identity.validity:P30D}") Duration validity) {
        return new IdentityFingerprintGenerator(IdentityFingerprintGenerator.defaultCollectors(), clock, validity);
    }
}
