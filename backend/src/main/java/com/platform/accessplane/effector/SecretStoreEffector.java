package com.platform.accessplane.effector;

import com.platform.accessplane.inventory.Cluster;
import com.platform.accessplane.inventory.ObservedApiKey;
import com.platform.accessplane.inventory.ObservedServiceAccount;
import com.platform.accessplane.inventory.StoredSecret;

import java.util.List;
import java.util.Map;

/**
 * Write side of the secret store.
 */
public interface SecretStoreEffector {
    
    String TAG_REST_PROXY_ACCESS = "rest_proxy_access";
    String TAG_SYNC_NEEDED_FOR_RP = "sync_needed_for_rp";
    
    /**
     * Writes the credentials of {@code apiKey} into the slot secret of its account and cluster.
     * The key must still carry its secret value.
     */
    StoredSecret upsertSecret(ObservedApiKey apiKey, ObservedServiceAccount serviceAccount, Cluster cluster,
                              boolean restProxyAccess);
    
    StoredSecret tagSecret(String secretName, Map<String, String> tags);
    
    /**
     * Writes the aggregate credentials of a rest proxy user and clears the sync flag of
     * every secret merged into it.
     */
    StoredSecret upsertRestProxySecret(String secretName, ObservedServiceAccount restProxyUser, Cluster cluster,
                                       List<ObservedApiKey> newApiKeys, List<StoredSecret> syncedSecrets,
                                       boolean isNew);
}
