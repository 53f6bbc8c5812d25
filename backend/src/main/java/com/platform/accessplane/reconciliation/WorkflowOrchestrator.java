package com.platform.accessplane.reconciliation;

import com.platform.accessplane.config.AccessPlaneProperties;
import com.platform.accessplane.declaration.Declaration;
import com.platform.accessplane.effector.ProviderEffector;
import com.platform.accessplane.effector.SecretStoreEffector;
import com.platform.accessplane.error.AccessPlaneException;
import com.platform.accessplane.error.ErrorCode;
import com.platform.accessplane.error.ResourceNotFoundException;
import com.platform.accessplane.inventory.Cluster;
import com.platform.accessplane.inventory.InventoryService;
import com.platform.accessplane.inventory.ObservedApiKey;
import com.platform.accessplane.inventory.ObservedServiceAccount;
import com.platform.accessplane.inventory.ObservedState;
import com.platform.accessplane.inventory.StoredSecret;
import com.platform.accessplane.observability.ReconciliationMetrics;
import com.platform.accessplane.task.LedgerReport;
import com.platform.accessplane.task.Task;
import com.platform.accessplane.task.TaskLedger;
import com.platform.accessplane.task.TaskPayload;
import com.platform.accessplane.task.TaskPayload.ApiKeyPayload;
import com.platform.accessplane.task.TaskPayload.RestProxyPayload;
import com.platform.accessplane.task.TaskPayload.SecretPayload;
import com.platform.accessplane.task.TaskPayload.SecretTagPayload;
import com.platform.accessplane.task.TaskPayload.ServiceAccountPayload;
import com.platform.accessplane.task.TaskStatus;
import com.platform.accessplane.task.TaskType;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Runs the reconciliation phases in dependency order against a fresh inventory snapshot each.
 * 
 * Every task is resolved exactly once: a failing effector call marks its own task FAILED and
 * the remaining tasks of the phase still run. In dry-run mode tasks are recorded and logged
 * but left NOT_STARTED.
 */
@Slf4j
@Component
public class WorkflowOrchestrator {
    
    private final InventoryService inventoryService;
    private final ProviderEffector providerEffector;
    private final SecretStoreEffector secretStoreEffector;
    private final ReconciliationMetrics metrics;
    private final AccessPlaneProperties properties;
    private final Clock clock;
    
    public WorkflowOrchestrator(
            InventoryService inventoryService,
            ProviderEffector providerEffector,
            SecretStoreEffector secretStoreEffector,
            ReconciliationMetrics metrics,
            AccessPlaneProperties properties,
            Clock clock) {
        this.inventoryService = inventoryService;
        this.providerEffector = providerEffector;
        this.secretStoreEffector = secretStoreEffector;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
    }
    
    public ReconciliationRun run(Declaration declaration) {
        return run(declaration, properties.isDryRun());
    }
    
    public ReconciliationRun run(Declaration declaration, boolean dryRun) {
        String runId = UUID.randomUUID().toString().substring(0, 8);
        Instant startedAt = clock.instant();
        TaskLedger ledger = new TaskLedger();
        RunContext ctx = new RunContext(declaration, ledger, ReconciliationSettings.from(properties), dryRun);
        
        MDC.put("runId", runId);
        try {
            log.info("Starting reconciliation run {} for {} declared service accounts (dryRun={})",
                runId, declaration.serviceAccounts().size(), dryRun);
            
            for (Phase phase : Phase.values()) {
                if (phase.managesApiKeys() && !properties.getCcloud().isEnableApiKeyManagement()) {
                    log.info("API key management disabled; skipping phase {}", phase.label());
                    continue;
                }
                runPhase(phase, ctx);
            }
            
            Instant finishedAt = clock.instant();
            ReconciliationRun run = new ReconciliationRun(runId, dryRun, startedAt, finishedAt, ledger);
            metrics.recordRun(run.duration(), dryRun);
            log.info("Reconciliation run {} finished: {}\n{}", runId, run.summary(), LedgerReport.render(ledger));
            return run;
        } finally {
            MDC.remove("runId");
        }
    }
    
    private void runPhase(Phase phase, RunContext ctx) {
        MDC.put("phase", phase.label());
        try {
            ObservedState observed = inventoryService.read(
                Set.copyOf(properties.getCcloud().getIgnoreServiceAccountList()),
                properties.getCcloud().isDetectIgnoreCcloudInternalAccounts());
            
            switch (phase) {
                case SERVICE_ACCOUNT_CREATE -> execute(ctx, 
                    new ServiceAccountReconciler(ctx.declaration, observed, ctx.settings).createTasks(),
                    this::createServiceAccount);
                case SERVICE_ACCOUNT_DELETE -> execute(ctx,
                    new ServiceAccountReconciler(ctx.declaration, observed, ctx.settings).deleteTasks(),
                    this::deleteServiceAccount);
                case API_KEY_CREATE -> {
                    ApiKeyReconciler reconciler = new ApiKeyReconciler(ctx.declaration, observed, ctx.settings);
                    ctx.apiKeyPlan = reconciler.plan();
                    execute(ctx, reconciler.createTasks(ctx.apiKeyPlan), task -> createApiKey(task, observed));
                }
                case API_KEY_DELETE -> execute(ctx,
                    new ApiKeyReconciler(ctx.declaration, observed, ctx.settings).deleteTasks(),
                    this::deleteApiKey);
                case SECRET_UPSERT -> execute(ctx,
                    new SecretReconciler(ctx.declaration, observed, ctx.settings).secretTasks(ctx.apiKeyPlan),
                    task -> upsertSecret(task, observed));
                case SECRET_TAGS -> execute(ctx,
                    new SecretReconciler(ctx.declaration, observed, ctx.settings).tagTasks(),
                    this::tagSecret);
                case REST_PROXY -> execute(ctx,
                    new SecretReconciler(ctx.declaration, observed, ctx.settings).restProxyTasks(ctx.newApiKeyIds()),
                    task -> upsertRestProxySecret(task, observed));
                default -> throw new IllegalStateException("Unhandled phase " + phase);
            }
        } finally {
            MDC.remove("phase");
        }
    }
    
    private void execute(RunContext ctx, List<Task> tasks, TaskHandler handler) {
        Set<Integer> added = new LinkedHashSet<>(ctx.ledger.addAll(tasks));
        if (added.isEmpty()) {
            log.info("No tasks");
            return;
        }
        added.forEach(key -> log.info("Planned {}", LedgerReport.row(key, ctx.ledger.get(key))));
        if (ctx.dryRun) {
            return;
        }
        // only the pending tasks this phase added
        Map<Integer, Task> pending = ctx.ledger.selectPending();
        pending.forEach((key, task) -> {
            if (added.contains(key)) {
                apply(ctx, key, task, handler);
            }
        });
    }
    
    private void apply(RunContext ctx, int key, Task task, TaskHandler handler) {
        try {
            TaskOutcome outcome = handler.handle(task);
            ctx.ledger.setStatus(key, TaskStatus.SUCCESS, outcome.message(), outcome.payload());
        } catch (AccessPlaneException e) {
            log.warn("Task {} failed [{}]: {}", key, e.getErrorCode().getCode(), e.getMessage());
            metrics.recordError(e.getErrorCode());
            ctx.ledger.setStatus(key, TaskStatus.FAILED, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Task {} failed unexpectedly", key, e);
            metrics.recordError(ErrorCode.INTERNAL_ERROR);
            ctx.ledger.setStatus(key, TaskStatus.FAILED, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        metrics.recordTask(task);
    }
    
    // ==================== Task handlers ====================
    
    private TaskOutcome createServiceAccount(Task task) {
        ServiceAccountPayload payload = (ServiceAccountPayload) task.getPayload();
        ObservedServiceAccount created = providerEffector.createServiceAccount(payload.saName(), payload.description());
        return new TaskOutcome("Service account created", payload.withSaId(created.resourceId()));
    }
    
    private TaskOutcome deleteServiceAccount(Task task) {
        ServiceAccountPayload payload = (ServiceAccountPayload) task.getPayload();
        boolean deleted = providerEffector.deleteServiceAccount(payload.saName());
        return new TaskOutcome(deleted ? "Service account deleted" : "Service account already absent", null);
    }
    
    private TaskOutcome createApiKey(Task task, ObservedState observed) {
        ApiKeyPayload payload = (ApiKeyPayload) task.getPayload();
        ObservedServiceAccount sa = observed.findServiceAccount(payload.saName())
            .orElseThrow(() -> ResourceNotFoundException.serviceAccount(payload.saName()));
        ObservedApiKey key = providerEffector.createApiKey(payload.envId(), payload.clusterId(), sa.resourceId(),
            "API Key for " + payload.saName() + " created by the CI/CD framework.");
        return new TaskOutcome("API key created", payload.withApiKeyId(key.keyId()));
    }
    
    private TaskOutcome deleteApiKey(Task task) {
        ApiKeyPayload payload = (ApiKeyPayload) task.getPayload();
        boolean deleted = providerEffector.deleteApiKey(payload.apiKeyId());
        return new TaskOutcome(deleted ? "API key deleted" : "API key already absent", null);
    }
    
    private TaskOutcome upsertSecret(Task task, ObservedState observed) {
        SecretPayload payload = (SecretPayload) task.getPayload();
        ObservedServiceAccount sa = observed.findServiceAccount(payload.saName())
            .orElseThrow(() -> ResourceNotFoundException.serviceAccount(payload.saName()));
        Cluster cluster = observed.findCluster(payload.clusterId())
            .orElseThrow(() -> ResourceNotFoundException.cluster(payload.clusterId()));
        ObservedApiKey key = observed.keysFor(sa.resourceId(), payload.clusterId()).stream()
            .filter(ObservedApiKey::hasSecret)
            .max(Comparator.comparing(ObservedApiKey::createdAt, Comparator.nullsFirst(Comparator.naturalOrder())))
            .orElseThrow(() -> new ResourceNotFoundException(ErrorCode.API_KEY_SECRET_UNAVAILABLE,
                "API key with retrievable secret", CompositeKey.of(payload.saName(), payload.clusterId()).toString()));
        StoredSecret stored = secretStoreEffector.upsertSecret(key, sa, cluster, payload.needsRestProxyAccess());
        return new TaskOutcome(task.getTaskType() == TaskType.CREATE ? "Secret created" : "Secret updated",
            payload.withSecretName(stored.secretName()));
    }
    
    private TaskOutcome tagSecret(Task task) {
        SecretTagPayload payload = (SecretTagPayload) task.getPayload();
        secretStoreEffector.tagSecret(payload.secretName(), Map.of(
            SecretStoreEffector.TAG_REST_PROXY_ACCESS, String.valueOf(payload.restProxyAccess()),
            SecretStoreEffector.TAG_SYNC_NEEDED_FOR_RP, "true"));
        return new TaskOutcome("Secret tags updated", null);
    }
    
    private TaskOutcome upsertRestProxySecret(Task task, ObservedState observed) {
        RestProxyPayload payload = (RestProxyPayload) task.getPayload();
        ObservedServiceAccount restProxyUser = observed.findServiceAccount(payload.saName())
            .orElseThrow(() -> ResourceNotFoundException.serviceAccount(payload.saName()));
        Cluster cluster = observed.findCluster(payload.clusterId())
            .orElseThrow(() -> ResourceNotFoundException.cluster(payload.clusterId()));
        List<ObservedApiKey> newKeys = payload.newApiKeyIds().stream()
            .map(observed.apiKeys()::get)
            .filter(Objects::nonNull)
            .toList();
        List<StoredSecret> synced = payload.syncedSecretNames().stream()
            .map(observed.secrets()::get)
            .filter(Objects::nonNull)
            .toList();
        secretStoreEffector.upsertRestProxySecret(payload.restProxySecretName(), restProxyUser, cluster,
            newKeys, synced, task.getTaskType() == TaskType.CREATE);
        return new TaskOutcome("Rest proxy secret " + (task.getTaskType() == TaskType.CREATE ? "created" : "updated"),
            null);
    }
    
    // ==================== Run state ====================
    
    @FunctionalInterface
    interface TaskHandler {
        TaskOutcome handle(Task task);
    }
    
    record TaskOutcome(String message, TaskPayload payload) {
    }
    
    /**
     * Mutable state shared by the phases of one run.
     */
    private static final class RunContext {
        private final Declaration declaration;
        private final TaskLedger ledger;
        private final ReconciliationSettings settings;
        private final boolean dryRun;
        private ApiKeyPlan apiKeyPlan = ApiKeyPlan.EMPTY;
        
        RunContext(Declaration declaration, TaskLedger ledger, ReconciliationSettings settings, boolean dryRun) {
            this.declaration = declaration;
            this.ledger = ledger;
            this.settings = settings;
            this.dryRun = dryRun;
        }
        
        /**
         * Ids of the API keys created successfully so far in this run.
         */
        Set<String> newApiKeyIds() {
            Set<String> ids = new LinkedHashSet<>();
            ledger.filter(Set.of(TaskType.CREATE)).values().stream()
                .filter(task -> task.getStatus() == TaskStatus.SUCCESS)
                .map(Task::getPayload)
                .filter(ApiKeyPayload.class::isInstance)
                .map(payload -> ((ApiKeyPayload) payload).apiKeyId())
                .filter(Objects::nonNull)
                .forEach(ids::add);
            return ids;
        }
    }
}
