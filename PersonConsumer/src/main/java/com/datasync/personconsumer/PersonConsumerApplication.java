package com.datasync.personconsumer;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Person Consumer Application
 *
 * Consumes person events from an Apache Artemis queue and upserts them into
 * the persons table using ActiveJDBC. Exits with a non-zero status when the
 * consumer cannot be started (e.g. broker unreachable after all retries).
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@Slf4j
public class PersonConsumerApplication {

    public static void main(String[] args) {
        try {
            SpringApplication.run(PersonConsumerApplication.class, args);
        } catch (Exception e) {
            log.error("Person consumer bootstrap failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

}
