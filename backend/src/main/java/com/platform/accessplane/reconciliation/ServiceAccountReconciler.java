package com.platform.accessplane.reconciliation;

import com.platform.accessplane.declaration.Declaration;
import com.platform.accessplane.declaration.ServiceAccountDefinition;
import com.platform.accessplane.inventory.ObservedServiceAccount;
import com.platform.accessplane.inventory.ObservedState;
import com.platform.accessplane.task.Task;
import com.platform.accessplane.task.TaskPayload.ServiceAccountPayload;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Diffs declared service accounts against the provider.
 */
@Slf4j
public class ServiceAccountReconciler {
    
    private static final Comparator<ServiceAccountDefinition> CREATE_ORDER = Comparator
        .comparing((ServiceAccountDefinition sa) -> !sa.restProxyUser())
        .thenComparing(ServiceAccountDefinition::name);
    
    private final Declaration declaration;
    private final ObservedState observed;
    private final ReconciliationSettings settings;
    
    public ServiceAccountReconciler(Declaration declaration, ObservedState observed, ReconciliationSettings settings) {
        this.declaration = declaration;
        this.observed = observed;
        this.settings = settings;
    }
    
    public Set<String> namesToCreate() {
        return SetDiff.toCreate(declaration.names(), observed.serviceAccountNames());
    }
    
    /**
     * Undeclared accounts minus ignore-listed ones, regardless of the cleanup flag.
     */
    public Set<String> namesToDelete() {
        Set<String> undeclared = SetDiff.toDelete(declaration.names(), observed.serviceAccountNames());
        return SetDiff.toCreate(undeclared, observed.ignoredAccountNames());
    }
    
    /**
     * Rest proxy users come first, then the other accounts, each group by name.
     */
    public List<Task> createTasks() {
        return namesToCreate().stream()
            .map(declaration::findServiceAccount)
            .flatMap(Optional::stream)
            .sorted(CREATE_ORDER)
            .map(sa -> Task.create(ServiceAccountPayload.forCreate(sa.name(), sa.descriptionOrDefault())))
            .toList();
    }
    
    public List<Task> deleteTasks() {
        Set<String> names = new TreeSet<>(namesToDelete());
        if (!settings.enableSaCleanup()) {
            if (!names.isEmpty()) {
                log.info("Service account cleanup disabled; {} undeclared accounts left in place: {}", 
                    names.size(), names);
            }
            return List.of();
        }
        return names.stream()
            .map(name -> {
                String saId = observed.findServiceAccount(name)
                    .map(ObservedServiceAccount::resourceId)
                    .orElse(null);
                return Task.delete(new ServiceAccountPayload(name, null, saId));
            })
            .toList();
    }
}
