package com.bikerly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

@SpringBootApplication
public class BikerlyApplication {

    public static void main(String[] args) {
        SpringApplication.run(BikerlyApplication.class, args);
    }

    /**
     * Shared time source for token expiry and rate-limit windows.
     * Tests construct services with a fixed or mutable clock instead.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
