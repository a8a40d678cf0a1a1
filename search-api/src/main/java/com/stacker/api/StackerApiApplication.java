package com.stacker.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot entry point of the Stacker search API.
 *
 * <p>Scans {@code com.stacker} so the shared wiring in {@code com.stacker.config} is picked up.</p>
 */
@SpringBootApplication(scanBasePackages = "com.stacker")
public class StackerApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(StackerApiApplication.class, args);
    }
}
