package com.platform.accessplane.inventory;

/**
 * Secret-store entry holding the credentials of one API key slot, or the aggregate
 * credentials of a rest proxy user when {@code restProxyAggregate} is set.
 */
public record StoredSecret(
    String secretName,
    String saName,
    String saId,
    String clusterId,
    String apiKeyId,
    boolean restProxyAccess,
    boolean restProxySyncNeeded,
    boolean restProxyAggregate
) {
    
    public StoredSecret withRestProxyTags(boolean access, boolean syncNeeded) {
        return new StoredSecret(secretName, saName, saId, clusterId, apiKeyId, access, syncNeeded, restProxyAggregate);
    }
    
    public boolean awaitingRestProxySync() {
        return restProxyAccess && restProxySyncNeeded;
    }
}
