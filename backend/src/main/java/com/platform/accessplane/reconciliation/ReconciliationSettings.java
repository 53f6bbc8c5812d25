package com.platform.accessplane.reconciliation;

import com.platform.accessplane.config.AccessPlaneProperties;

/**
 * Global flags the reconcilers read. The ignore set is not here: it comes with each
 * observed-state snapshot.
 */
public record ReconciliationSettings(
    boolean enableSaCleanup,
    long oldApiKeysDeletionWaitMins,
    String secretPrefix,
    String restProxySecretPrefix
) {
    
    public static ReconciliationSettings from(AccessPlaneProperties properties) {
        return new ReconciliationSettings(
            properties.getCcloud().isEnableSaCleanup(),
            properties.getCcloud().getOldApiKeysDeletionWaitMins(),
            properties.getSecretStore().getSecretPrefix(),
            properties.getSecretStore().getRestProxySecretPrefix()
        );
    }
    
    public String restProxySecretName(String saName, String clusterId) {
        return restProxySecretPrefix + saName + "/" + clusterId;
    }
    
    public String secretName(String saName, String clusterId) {
        return secretPrefix + saName + "/" + clusterId;
    }
}
