package com.platform.accessplane.reconciliation;

import com.platform.accessplane.declaration.Declaration;
import com.platform.accessplane.declaration.ServiceAccountDefinition;
import com.platform.accessplane.inventory.Cluster;
import com.platform.accessplane.inventory.ObservedApiKey;
import com.platform.accessplane.inventory.ObservedServiceAccount;
import com.platform.accessplane.inventory.ObservedState;
import com.platform.accessplane.task.Task;
import com.platform.accessplane.task.TaskPayload.ApiKeyPayload;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Diffs declared API key slots against the provider and the secret store.
 * 
 * A key's secret can only be read when the key is created. A declared slot whose key
 * exists but whose secret never reached the secret store can therefore only be repaired
 * by creating a fresh key, so such slots are added to the create set.
 */
@Slf4j
public class ApiKeyReconciler {
    
    private final Declaration declaration;
    private final ObservedState observed;
    private final ReconciliationSettings settings;
    
    public ApiKeyReconciler(Declaration declaration, ObservedState observed, ReconciliationSettings settings) {
        this.declaration = declaration;
        this.observed = observed;
        this.settings = settings;
    }
    
    /**
     * Declared slots with the wildcard expanded against the clusters in this snapshot.
     */
    public Set<CompositeKey> declaredKeys() {
        Set<CompositeKey> keys = new LinkedHashSet<>();
        for (ServiceAccountDefinition sa : declaration.serviceAccounts()) {
            for (String clusterId : sa.resolveClusters(observed.clusterIds())) {
                keys.add(CompositeKey.of(sa.name(), clusterId));
            }
        }
        return keys;
    }
    
    /**
     * Slots of declared accounts that already hold at least one key.
     */
    public Set<CompositeKey> observedKeys() {
        Set<CompositeKey> keys = new LinkedHashSet<>();
        for (ServiceAccountDefinition sa : declaration.serviceAccounts()) {
            String saId = observed.findServiceAccount(sa.name())
                .map(ObservedServiceAccount::resourceId)
                .orElse(null);
            for (ObservedApiKey key : observed.keysOwnedBy(saId)) {
                keys.add(CompositeKey.of(sa.name(), key.clusterId()));
            }
        }
        return keys;
    }
    
    public Set<CompositeKey> storedKeys() {
        return observed.slotSecrets().stream()
            .map(secret -> CompositeKey.of(secret.saName(), secret.clusterId()))
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }
    
    public ApiKeyPlan plan() {
        Set<CompositeKey> declared = declaredKeys();
        Set<CompositeKey> stored = storedKeys();
        
        Set<CompositeKey> createKeys = SetDiff.toCreate(declared, observedKeys());
        Set<CompositeKey> createSecrets = SetDiff.toCreate(declared, stored);
        Set<CompositeKey> updateSecrets = SetDiff.intersection(createKeys, stored);
        Set<CompositeKey> forced = SetDiff.toCreate(createSecrets, createKeys);
        
        if (!forced.isEmpty()) {
            log.warn("API keys exist without a stored secret and will be recreated: {}", forced);
        }
        return new ApiKeyPlan(SetDiff.union(createKeys, forced), createSecrets, updateSecrets, forced);
    }
    
    public List<Task> createTasks(ApiKeyPlan plan) {
        List<Task> tasks = new ArrayList<>();
        for (CompositeKey slot : plan.createKeys()) {
            Optional<Cluster> cluster = observed.findCluster(slot.clusterId());
            if (cluster.isEmpty()) {
                log.warn("Cluster {} declared for {} is not known to the provider; skipping API key creation",
                    slot.clusterId(), slot.saName());
                continue;
            }
            tasks.add(Task.create(new ApiKeyPayload(slot.saName(), slot.clusterId(), cluster.get().envId(), null)));
        }
        return tasks;
    }
    
    /**
     * Declared-account slots that hold keys but are no longer declared, excluding ignored accounts.
     */
    public Set<CompositeKey> orphanKeys() {
        Set<String> ignoredNames = observed.ignoredAccountNames();
        return SetDiff.toDelete(declaredKeys(), observedKeys()).stream()
            .filter(slot -> !ignoredNames.contains(slot.saName()))
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }
    
    /**
     * Keys anywhere in the provider that are older than the configured wait, belong to a
     * non-ignored account and are not referenced by any secret. A key without a known
     * creation time is never old.
     */
    public List<ObservedApiKey> agedKeys() {
        Set<String> referenced = observed.referencedApiKeyIds();
        return observed.apiKeys().values().stream()
            .filter(ObservedApiKey::hasCreationTime)
            .filter(key -> key.minutesSinceCreation(observed.readAt()) > settings.oldApiKeysDeletionWaitMins())
            .filter(key -> !observed.isIgnored(key.ownerId()))
            .filter(key -> !referenced.contains(key.keyId()))
            .sorted(Comparator.comparing(ObservedApiKey::keyId))
            .toList();
    }
    
    public List<Task> deleteTasks() {
        Map<String, Task> byKeyId = new LinkedHashMap<>();
        for (CompositeKey slot : new TreeSet<>(orphanKeys())) {
            String saId = observed.findServiceAccount(slot.saName())
                .map(ObservedServiceAccount::resourceId)
                .orElse(null);
            for (ObservedApiKey key : observed.keysFor(saId, slot.clusterId())) {
                byKeyId.put(key.keyId(), deleteTask(slot.saName(), key));
            }
        }
        for (ObservedApiKey key : agedKeys()) {
            String saName = Optional.ofNullable(observed.serviceAccounts().get(key.ownerId()))
                .map(ObservedServiceAccount::name)
                .orElse(key.ownerId());
            byKeyId.putIfAbsent(key.keyId(), deleteTask(saName, key));
        }
        return List.copyOf(byKeyId.values());
    }
    
    private Task deleteTask(String saName, ObservedApiKey key) {
        return Task.delete(new ApiKeyPayload(saName, key.clusterId(), key.envId(), key.keyId()));
    }
}
