package com.platform.accessplane.inventory;

import java.time.Instant;

/**
 * Service account as reported by the provider.
 */
public record ObservedServiceAccount(
    String resourceId,
    String name,
    String description,
    Instant createdAt,
    Instant updatedAt,
    boolean ignored
) {
    
    public ObservedServiceAccount withIgnored(boolean isIgnored) {
        return new ObservedServiceAccount(resourceId, name, description, createdAt, updatedAt, isIgnored);
    }
}
