package com.esplanada.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * Esplanada Ratings API Application
 *
 * Rating integrity and aggregation engine for restaurant reviews.
 */
@SpringBootApplication(scanBasePackages = "com.esplanada")
@EntityScan(basePackages = "com.esplanada.core.domain")
@EnableJpaRepositories(basePackages = "com.esplanada.core.repository")
public class EsplanadaApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(EsplanadaApiApplication.class, args);
    }
}
