package com.governance.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * Main application entry point for the governance control plane.
 */
@SpringBootApplication
@ComponentScan(basePackages = {
    "com.governance.api",
    "com.governance.engine"
})
public class GovernanceApplication {

    public static void main(String[] args) {
        SpringApplication.run(GovernanceApplication.class, args);
    }
}
