package com.platform.accessplane.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the access plane.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "accessplane")
@Validated
public class AccessPlaneProperties {
    
    /**
     * Path of the service account definitions YAML.
     */
    private String definitionsFile = "definitions.yaml";
    
    /**
     * Compute and report tasks without calling Confluent Cloud or the secret store.
     */
    private boolean dryRun = true;
    
    /**
     * Run one reconciliation when the application starts.
     */
    private boolean runOnStartup = true;
    
    @Valid
    private Ccloud ccloud = new Ccloud();
    
    @Valid
    private SecretStore secretStore = new SecretStore();
    
    /**
     * Confluent Cloud connection and reconciliation flags.
     */
    @Data
    public static class Ccloud {
        
        @NotBlank
        private String baseUrl = "https://api.confluent.cloud";
        
        /**
         * Cloud API key. Must be set together with {@code apiSecret}.
         */
        private String apiKey;
        
        private String apiSecret;
        
        private int connectionTimeoutMs = 5000;
        
        private int readTimeoutMs = 30000;
        
        @Min(1)
        private int pageSize = 50;
        
        /**
         * Service account resource ids that are never deleted and whose keys are never cleaned up.
         */
        private List<String> ignoreServiceAccountList = new ArrayList<>();
        
        /**
         * Delete service accounts that are no longer declared.
         */
        private boolean enableSaCleanup = false;
        
        /**
         * Treat connector and ksqlDB managed service accounts as ignored.
         */
        private boolean detectIgnoreCcloudInternalAccounts = true;
        
        /**
         * Minimum age before an API key not referenced by any secret is deleted.
         */
        @Min(0)
        private long oldApiKeysDeletionWaitMins = 30;
        
        /**
         * Run the API key, secret and rest proxy phases.
         */
        private boolean enableApiKeyManagement = true;
    }
    
    /**
     * Secret store location and naming.
     */
    @Data
    public static class SecretStore {
        
        /**
         * JSON file holding the stored secrets. Required unless running dry.
         */
        private String file;
        
        @NotBlank
        private String secretPrefix = "/ccloud/";
        
        @NotBlank
        private String restProxySecretPrefix = "/ccloud/rest-proxy/";
    }
}
