package com.platform.accessplane.inventory;

import java.util.List;

/**
 * Read side of the cloud provider. Each call returns a complete, already paginated snapshot.
 */
public interface ProviderInventory {
    
    List<ObservedServiceAccount> listServiceAccounts();
    
    List<ObservedApiKey> listApiKeys();
    
    List<Cluster> listClusters();
}
