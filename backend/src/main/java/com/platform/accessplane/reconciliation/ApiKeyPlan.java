package com.platform.accessplane.reconciliation;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Slot-level outcome of the API key diff, shared with the secret phase.
 * All sets iterate in composite key order.
 *
 * @param createKeys        slots that need a new API key, including forced recreations
 * @param createSecrets     declared slots with no secret-store entry
 * @param updateSecrets     slots that get a new key while a secret already exists
 * @param forcedRecreations slots whose key exists but whose secret is missing
 */
public record ApiKeyPlan(
    Set<CompositeKey> createKeys,
    Set<CompositeKey> createSecrets,
    Set<CompositeKey> updateSecrets,
    Set<CompositeKey> forcedRecreations
) {
    
    public static final ApiKeyPlan EMPTY = new ApiKeyPlan(Set.of(), Set.of(), Set.of(), Set.of());
    
    public ApiKeyPlan {
        createKeys = sorted(createKeys);
        createSecrets = sorted(createSecrets);
        updateSecrets = sorted(updateSecrets);
        forcedRecreations = sorted(forcedRecreations);
    }
    
    private static Set<CompositeKey> sorted(Set<CompositeKey> keys) {
        return Collections.unmodifiableSortedSet(new TreeSet<>(keys));
    }
    
    public boolean isEmpty() {
        return createKeys.isEmpty() && createSecrets.isEmpty() && updateSecrets.isEmpty();
    }
}
