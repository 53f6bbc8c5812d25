package com.platform.accessplane;

import com.platform.accessplane.declaration.Declaration;
import com.platform.accessplane.declaration.ServiceAccountDefinition;
import com.platform.accessplane.inventory.Cluster;
import com.platform.accessplane.inventory.ObservedApiKey;
import com.platform.accessplane.inventory.ObservedServiceAccount;
import com.platform.accessplane.inventory.ObservedState;
import com.platform.accessplane.inventory.StoredSecret;
import com.platform.accessplane.reconciliation.ReconciliationSettings;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Builders for declarations and observed-state snapshots used across tests.
 */
public final class Fixtures {
    
    public static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    public static final String ENV = "env-1";
    
    private Fixtures() {
    }
    
    public static ServiceAccountDefinition definition(String name, String... clusters) {
        return new ServiceAccountDefinition(name, null, Arrays.asList(clusters), false, false);
    }
    
    public static ServiceAccountDefinition restProxyAccess(String name, String... clusters) {
        return new ServiceAccountDefinition(name, null, Arrays.asList(clusters), false, true);
    }
    
    public static ServiceAccountDefinition restProxyUser(String name, String... clusters) {
        return new ServiceAccountDefinition(name, null, Arrays.asList(clusters), true, false);
    }
    
    public static Declaration declaration(ServiceAccountDefinition... definitions) {
        return new Declaration(List.of(definitions));
    }
    
    public static ObservedServiceAccount sa(String id, String name) {
        return new ObservedServiceAccount(id, name, "", NOW.minus(Duration.ofDays(1)), NOW.minus(Duration.ofDays(1)), false);
    }
    
    public static ObservedApiKey key(String keyId, String ownerId, String clusterId, long minutesOld) {
        return new ObservedApiKey(keyId, ownerId, clusterId, ENV, null, NOW.minus(Duration.ofMinutes(minutesOld)));
    }
    
    public static Cluster cluster(String clusterId) {
        return new Cluster(clusterId, clusterId + "-name", ENV, "SASL_SSL://" + clusterId + ".example:9092",
            "https://" + clusterId + ".example:443");
    }
    
    public static StoredSecret secret(String saName, String saId, String clusterId, String apiKeyId) {
        return new StoredSecret("/ccloud/" + saName + "/" + clusterId, saName, saId, clusterId, apiKeyId,
            false, false, false);
    }
    
    public static ReconciliationSettings settings(boolean enableSaCleanup) {
        return new ReconciliationSettings(enableSaCleanup, 30, "/ccloud/", "/ccloud/rest-proxy/");
    }
    
    public static StateBuilder state() {
        return new StateBuilder();
    }
    
    public static final class StateBuilder {
        private final List<ObservedServiceAccount> accounts = new ArrayList<>();
        private final List<ObservedApiKey> keys = new ArrayList<>();
        private final List<Cluster> clusters = new ArrayList<>();
        private final List<StoredSecret> secrets = new ArrayList<>();
        private final Set<String> ignored = new HashSet<>();
        
        public StateBuilder accounts(ObservedServiceAccount... values) {
            accounts.addAll(List.of(values));
            return this;
        }
        
        public StateBuilder keys(ObservedApiKey... values) {
            keys.addAll(List.of(values));
            return this;
        }
        
        public StateBuilder clusters(String... clusterIds) {
            for (String clusterId : clusterIds) {
                clusters.add(cluster(clusterId));
            }
            return this;
        }
        
        public StateBuilder secrets(StoredSecret... values) {
            secrets.addAll(List.of(values));
            return this;
        }
        
        public StateBuilder ignored(String... resourceIds) {
            ignored.addAll(List.of(resourceIds));
            return this;
        }
        
        public ObservedState build() {
            return ObservedState.of(accounts, keys, clusters, secrets, ignored, NOW);
        }
    }
}
