package com.platform.accessplane.inventory;

import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Recognizes service accounts created and managed by the provider itself
 * (managed connectors, ksqlDB clusters).
 */
@Component
public class InternalAccountDetector {
    
    private static final List<String> INTERNAL_PREFIXES = List.of("Connect.lcc-", "KSQL.lksqlc-");
    
    public boolean isInternal(String saName) {
        if (saName == null) {
            return false;
        }
        return INTERNAL_PREFIXES.stream().anyMatch(saName::startsWith);
    }
}
