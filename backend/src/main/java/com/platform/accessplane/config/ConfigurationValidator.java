package com.platform.accessplane.config;

import com.platform.accessplane.error.ErrorCode;
import com.platform.accessplane.error.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Fail-fast checks on the access plane configuration, run before any reconciliation.
 */
@Slf4j
@Component
public class ConfigurationValidator {
    
    public void validate(AccessPlaneProperties properties) {
        validate(properties, properties.isDryRun());
    }
    
    /**
     * @param dryRun the dry-run mode the next run will actually use
     */
    public void validate(AccessPlaneProperties properties, boolean dryRun) {
        mandatory("accessplane.definitions-file", properties.getDefinitionsFile());
        
        AccessPlaneProperties.Ccloud ccloud = properties.getCcloud();
        mandatory("accessplane.ccloud.base-url", ccloud.getBaseUrl());
        pair("accessplane.ccloud.api-key", ccloud.getApiKey(),
            "accessplane.ccloud.api-secret", ccloud.getApiSecret());
        
        if (ccloud.getOldApiKeysDeletionWaitMins() < 0) {
            throw new ValidationException("accessplane.ccloud.old-api-keys-deletion-wait-mins must not be negative");
        }
        if (ccloud.getPageSize() <= 0) {
            throw new ValidationException("accessplane.ccloud.page-size must be positive");
        }
        
        mandatory("accessplane.secret-store.rest-proxy-secret-prefix",
            properties.getSecretStore().getRestProxySecretPrefix());
        
        // applying changes needs a store that outlives the process
        String storeFile = properties.getSecretStore().getFile();
        if (!dryRun && (storeFile == null || storeFile.isBlank())) {
            throw new ValidationException(ErrorCode.MISSING_REQUIRED_FIELD, "accessplane.secret-store.file",
                "accessplane.secret-store.file is required when dry-run is false");
        }
        
        log.debug("Configuration validated (dryRun={}, apiKeyManagement={}, saCleanup={})",
            dryRun, ccloud.isEnableApiKeyManagement(), ccloud.isEnableSaCleanup());
    }
    
    static void mandatory(String key, String value) {
        if (value == null || value.isBlank()) {
            throw ValidationException.missing(key);
        }
    }
    
    /**
     * Both values must be present.
     */
    static void pair(String firstKey, String firstValue, String secondKey, String secondValue) {
        boolean firstPresent = firstValue != null && !firstValue.isBlank();
        boolean secondPresent = secondValue != null && !secondValue.isBlank();
        if (!firstPresent || !secondPresent) {
            throw ValidationException.incompletePair(firstKey, secondKey);
        }
    }
}
