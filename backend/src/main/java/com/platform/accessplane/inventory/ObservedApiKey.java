package com.platform.accessplane.inventory;

import java.time.Duration;
import java.time.Instant;

/**
 * API key as reported by the provider.
 * 
 * The secret value is only returned when the key is created; keys read back from the
 * provider afterwards carry a null secret. {@code createdAt} is null when the provider
 * omitted the creation time.
 */
public record ObservedApiKey(
    String keyId,
    String ownerId,
    String clusterId,
    String envId,
    String secretValue,
    Instant createdAt
) {
    
    public boolean hasSecret() {
        return secretValue != null && !secretValue.isEmpty();
    }
    
    public boolean hasCreationTime() {
        return createdAt != null;
    }
    
    public long minutesSinceCreation(Instant now) {
        return Duration.between(createdAt, now).toMinutes();
    }
    
    public ObservedApiKey withSecretValue(String secret) {
        return new ObservedApiKey(keyId, ownerId, clusterId, envId, secret, createdAt);
    }
    
    @Override
    public String toString() {
        return String.format("ObservedApiKey[keyId=%s, ownerId=%s, clusterId=%s, envId=%s, secret=%s, createdAt=%s]",
            keyId, ownerId, clusterId, envId, hasSecret() ? "****" : "<none>", createdAt);
    }
}
