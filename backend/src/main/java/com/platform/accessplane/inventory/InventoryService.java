package com.platform.accessplane.inventory;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads a fresh observed-state snapshot from the provider and the secret store.
 * 
 * Internal-account detection does not touch the configured ignore list: the effective
 * ignore set is returned as part of the snapshot and threaded through the reconcilers.
 */
@Slf4j
@Service
public class InventoryService {
    
    private final ProviderInventory providerInventory;
    private final SecretInventory secretInventory;
    private final InternalAccountDetector internalAccountDetector;
    private final Clock clock;
    
    public InventoryService(
            ProviderInventory providerInventory,
            SecretInventory secretInventory,
            InternalAccountDetector internalAccountDetector,
            Clock clock) {
        this.providerInventory = providerInventory;
        this.secretInventory = secretInventory;
        this.internalAccountDetector = internalAccountDetector;
        this.clock = clock;
    }
    
    public ObservedState read(Set<String> configuredIgnoreIds, boolean detectInternalAccounts) {
        Instant readAt = clock.instant();
        Set<String> ignored = new HashSet<>(configuredIgnoreIds);
        
        List<ObservedServiceAccount> accounts = providerInventory.listServiceAccounts().stream()
            .map(sa -> {
                if (detectInternalAccounts && internalAccountDetector.isInternal(sa.name())) {
                    ignored.add(sa.resourceId());
                }
                boolean isIgnored = ignored.contains(sa.resourceId());
                log.debug("Found SA: {}; Is Ignored: {} with name {}", sa.resourceId(), isIgnored, sa.name());
                return sa.withIgnored(isIgnored);
            })
            .toList();
        
        List<ObservedApiKey> keys = providerInventory.listApiKeys();
        List<Cluster> clusters = providerInventory.listClusters();
        List<StoredSecret> secrets = secretInventory.listSecrets();
        
        log.info("Observed {} service accounts ({} ignored), {} API keys, {} clusters, {} secrets",
            accounts.size(), accounts.stream().filter(ObservedServiceAccount::ignored).count(),
            keys.size(), clusters.size(), secrets.size());
        
        return ObservedState.of(accounts, keys, clusters, secrets, ignored, readAt);
    }
}
