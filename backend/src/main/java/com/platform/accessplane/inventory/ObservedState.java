package com.platform.accessplane.inventory;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Immutable snapshot of the provider and the secret store, taken once per phase.
 * 
 * {@code ignoredAccountIds} is the effective ignore set for the snapshot: the configured
 * ids plus any internal accounts detected while reading.
 */
public record ObservedState(
    Map<String, ObservedServiceAccount> serviceAccounts,
    Map<String, ObservedApiKey> apiKeys,
    Map<String, Cluster> clusters,
    Map<String, StoredSecret> secrets,
    Set<String> ignoredAccountIds,
    Instant readAt
) {
    
    public ObservedState {
        serviceAccounts = Map.copyOf(serviceAccounts);
        apiKeys = Map.copyOf(apiKeys);
        clusters = Map.copyOf(clusters);
        secrets = Map.copyOf(secrets);
        ignoredAccountIds = Set.copyOf(ignoredAccountIds);
    }
    
    public static ObservedState of(
            Collection<ObservedServiceAccount> serviceAccounts,
            Collection<ObservedApiKey> apiKeys,
            Collection<Cluster> clusters,
            Collection<StoredSecret> secrets,
            Set<String> ignoredAccountIds,
            Instant readAt) {
        return new ObservedState(
            index(serviceAccounts, ObservedServiceAccount::resourceId),
            index(apiKeys, ObservedApiKey::keyId),
            index(clusters, Cluster::clusterId),
            index(secrets, StoredSecret::secretName),
            ignoredAccountIds,
            readAt
        );
    }
    
    private static <T> Map<String, T> index(Collection<T> values, Function<T, String> key) {
        Map<String, T> indexed = new LinkedHashMap<>();
        values.forEach(value -> indexed.put(key.apply(value), value));
        return indexed;
    }
    
    public Optional<ObservedServiceAccount> findServiceAccount(String saName) {
        return serviceAccounts.values().stream()
            .filter(sa -> sa.name().equals(saName))
            .findFirst();
    }
    
    public Optional<Cluster> findCluster(String clusterId) {
        return Optional.ofNullable(clusters.get(clusterId));
    }
    
    public Set<String> clusterIds() {
        return clusters.keySet();
    }
    
    public Set<String> serviceAccountNames() {
        return serviceAccounts.values().stream()
            .map(ObservedServiceAccount::name)
            .collect(Collectors.toSet());
    }
    
    /**
     * Names of accounts whose resource id is ignore-listed.
     */
    public Set<String> ignoredAccountNames() {
        return serviceAccounts.values().stream()
            .filter(sa -> ignoredAccountIds.contains(sa.resourceId()))
            .map(ObservedServiceAccount::name)
            .collect(Collectors.toSet());
    }
    
    public boolean isIgnored(String resourceId) {
        return ignoredAccountIds.contains(resourceId);
    }
    
    public List<ObservedApiKey> keysOwnedBy(String saId) {
        if (saId == null) {
            return List.of();
        }
        return apiKeys.values().stream()
            .filter(key -> saId.equals(key.ownerId()))
            .toList();
    }
    
    public List<ObservedApiKey> keysFor(String saId, String clusterId) {
        return keysOwnedBy(saId).stream()
            .filter(key -> clusterId.equals(key.clusterId()))
            .toList();
    }
    
    /**
     * Per-slot secrets, excluding rest proxy aggregates.
     */
    public List<StoredSecret> slotSecrets() {
        return secrets.values().stream()
            .filter(secret -> !secret.restProxyAggregate())
            .toList();
    }
    
    public Optional<StoredSecret> findSecret(String secretName) {
        return Optional.ofNullable(secrets.get(secretName));
    }
    
    /**
     * Ids of every API key currently referenced by a secret.
     */
    public Set<String> referencedApiKeyIds() {
        return slotSecrets().stream()
            .map(StoredSecret::apiKeyId)
            .filter(id -> id != null)
            .collect(Collectors.toSet());
    }
}
