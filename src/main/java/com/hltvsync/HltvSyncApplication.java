package com.hltvsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main Spring Boot application for the HLTV sync engine.
 */
@SpringBootApplication
public class HltvSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(HltvSyncApplication.class, args);
    }
}
