package com.platform.accessplane.inventory;

import java.util.List;

/**
 * Read side of the secret store.
 */
public interface SecretInventory {
    
    List<StoredSecret> listSecrets();
}
