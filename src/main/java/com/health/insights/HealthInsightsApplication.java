package com.health.insights;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class HealthInsightsApplication {

    public static void main(String[] args) {
        SpringApplication.run(HealthInsightsApplication.class, args);
    }
}
