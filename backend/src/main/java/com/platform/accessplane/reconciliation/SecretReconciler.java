package com.platform.accessplane.reconciliation;

import com.platform.accessplane.declaration.Declaration;
import com.platform.accessplane.declaration.ServiceAccountDefinition;
import com.platform.accessplane.inventory.Cluster;
import com.platform.accessplane.inventory.ObservedApiKey;
import com.platform.accessplane.inventory.ObservedState;
import com.platform.accessplane.inventory.StoredSecret;
import com.platform.accessplane.task.Task;
import com.platform.accessplane.task.TaskPayload.RestProxyPayload;
import com.platform.accessplane.task.TaskPayload.SecretPayload;
import com.platform.accessplane.task.TaskPayload.SecretTagPayload;
import com.platform.accessplane.task.TaskType;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Derives secret-store work from the API key plan and from the declared rest proxy users.
 */
@Slf4j
public class SecretReconciler {
    
    private final Declaration declaration;
    private final ObservedState observed;
    private final ReconciliationSettings settings;
    
    public SecretReconciler(Declaration declaration, ObservedState observed, ReconciliationSettings settings) {
        this.declaration = declaration;
        this.observed = observed;
        this.settings = settings;
    }
    
    /**
     * Create tasks for slots with no secret, update tasks for slots that received a new key.
     */
    public List<Task> secretTasks(ApiKeyPlan plan) {
        List<Task> tasks = new ArrayList<>();
        plan.createSecrets().forEach(slot -> secretPayload(slot).map(Task::create).ifPresent(tasks::add));
        plan.updateSecrets().forEach(slot -> secretPayload(slot).map(Task::update).ifPresent(tasks::add));
        return tasks;
    }
    
    private Optional<SecretPayload> secretPayload(CompositeKey slot) {
        Optional<Cluster> cluster = observed.findCluster(slot.clusterId());
        Optional<ServiceAccountDefinition> definition = declaration.findServiceAccount(slot.saName());
        if (cluster.isEmpty() || definition.isEmpty()) {
            log.warn("Skipping secret for {}: cluster or service account definition not found", slot);
            return Optional.empty();
        }
        return Optional.of(new SecretPayload(
            slot.saName(),
            slot.clusterId(),
            cluster.get().envId(),
            definition.get().needsRestProxyAccess(),
            definition.get().restProxyUser(),
            settings.secretName(slot.saName(), slot.clusterId())
        ));
    }
    
    /**
     * Update tasks for stored secrets whose rest proxy access tag disagrees with the declaration.
     */
    public List<Task> tagTasks() {
        List<Task> tasks = new ArrayList<>();
        observed.slotSecrets().stream()
            .sorted(Comparator.comparing(StoredSecret::secretName))
            .forEach(secret -> declaration.findServiceAccount(secret.saName())
                .filter(sa -> sa.needsRestProxyAccess() != secret.restProxyAccess())
                .ifPresent(sa -> tasks.add(Task.update(new SecretTagPayload(
                    secret.secretName(), secret.saName(), secret.clusterId(), sa.needsRestProxyAccess())))));
        return tasks;
    }
    
    /**
     * Every (rest proxy user, cluster) pair, wildcard expanded against this snapshot.
     */
    public Set<CompositeKey> restProxyMembers() {
        Set<CompositeKey> members = new TreeSet<>();
        for (ServiceAccountDefinition sa : declaration.restProxyUsers()) {
            for (String clusterId : sa.resolveClusters(observed.clusterIds())) {
                members.add(CompositeKey.of(sa.name(), clusterId));
            }
        }
        return members;
    }
    
    /**
     * Upserts of rest proxy aggregate secrets, emitted only for clusters that received a new
     * rest-proxy-enabled key in this run or hold a secret flagged for rest proxy sync.
     *
     * @param newApiKeyIds ids of the keys created earlier in this run
     */
    public List<Task> restProxyTasks(Set<String> newApiKeyIds) {
        List<Task> tasks = new ArrayList<>();
        for (CompositeKey member : restProxyMembers()) {
            String secretName = settings.restProxySecretName(member.saName(), member.clusterId());
            
            List<String> newKeys = observed.apiKeys().values().stream()
                .filter(key -> newApiKeyIds.contains(key.keyId()))
                .filter(key -> member.clusterId().equals(key.clusterId()))
                .filter(this::ownerNeedsRestProxyAccess)
                .map(ObservedApiKey::keyId)
                .sorted()
                .toList();
            List<String> pendingSecrets = observed.slotSecrets().stream()
                .filter(secret -> member.clusterId().equals(secret.clusterId()))
                .filter(StoredSecret::awaitingRestProxySync)
                .map(StoredSecret::secretName)
                .sorted()
                .toList();
            
            if (newKeys.isEmpty() && pendingSecrets.isEmpty()) {
                continue;
            }
            TaskType taskType = observed.findSecret(secretName).isPresent() ? TaskType.UPDATE : TaskType.CREATE;
            tasks.add(new Task(taskType, new RestProxyPayload(
                member.saName(), member.clusterId(), secretName, newKeys, pendingSecrets)));
        }
        return tasks;
    }
    
    private boolean ownerNeedsRestProxyAccess(ObservedApiKey key) {
        return Optional.ofNullable(observed.serviceAccounts().get(key.ownerId()))
            .flatMap(sa -> declaration.findServiceAccount(sa.name()))
            .map(ServiceAccountDefinition::needsRestProxyAccess)
            .orElse(false);
    }
}
