package com.platform.accessplane.effector;

import com.platform.accessplane.inventory.ObservedApiKey;
import com.platform.accessplane.inventory.ObservedServiceAccount;

/**
 * Write side of the cloud provider. Failures are raised as
 * {@link com.platform.accessplane.error.ProviderException}.
 */
public interface ProviderEffector {
    
    /**
     * Creates the account, or returns the existing one when the name is already taken.
     */
    ObservedServiceAccount createServiceAccount(String name, String description);
    
    /**
     * @return false when no account with that name exists
     */
    boolean deleteServiceAccount(String name);
    
    /**
     * Creates a cluster-scoped key. The returned key is the only copy that carries the secret.
     */
    ObservedApiKey createApiKey(String envId, String clusterId, String saId, String description);
    
    /**
     * @return false when the key no longer exists
     */
    boolean deleteApiKey(String keyId);
}
