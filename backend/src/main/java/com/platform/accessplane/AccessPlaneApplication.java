package com.platform.accessplane;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Access Plane Application
 * 
 * Reconciles declared Confluent Cloud service accounts, API keys and their stored secrets:
 * - Service account creation and cleanup
 * - Per-cluster API key provisioning, orphan and aged key cleanup
 * - Secret-store upserts, rest proxy access tags and aggregate rest proxy secrets
 */
@SpringBootApplication
public class AccessPlaneApplication {

    public static void main(String[] args) {
        SpringApplication.run(AccessPlaneApplication.class, args);
    }
}
