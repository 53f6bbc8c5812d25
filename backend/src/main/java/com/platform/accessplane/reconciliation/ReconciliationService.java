package com.platform.accessplane.reconciliation;

import com.platform.accessplane.config.AccessPlaneProperties;
import com.platform.accessplane.config.ConfigurationValidator;
import com.platform.accessplane.declaration.Declaration;
import com.platform.accessplane.declaration.DefinitionsLoader;
import com.platform.accessplane.error.ErrorCode;
import com.platform.accessplane.error.ResourceNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Entry point for a reconciliation: validates configuration, loads the definitions file and
 * hands both to the orchestrator. Runs are serialized; the latest one is kept for inspection.
 */
@Slf4j
@Service
public class ReconciliationService {
    
    private final AccessPlaneProperties properties;
    private final ConfigurationValidator configurationValidator;
    private final DefinitionsLoader definitionsLoader;
    private final WorkflowOrchestrator orchestrator;
    
    private final AtomicReference<ReconciliationRun> lastRun = new AtomicReference<>();
    
    public ReconciliationService(
            AccessPlaneProperties properties,
            ConfigurationValidator configurationValidator,
            DefinitionsLoader definitionsLoader,
            WorkflowOrchestrator orchestrator) {
        this.properties = properties;
        this.configurationValidator = configurationValidator;
        this.definitionsLoader = definitionsLoader;
        this.orchestrator = orchestrator;
    }
    
    /**
     * @param dryRunOverride overrides {@code accessplane.dry-run} when non-null
     */
    public synchronized ReconciliationRun reconcile(Boolean dryRunOverride) {
        boolean dryRun = dryRunOverride != null ? dryRunOverride : properties.isDryRun();
        configurationValidator.validate(properties, dryRun);
        Declaration declaration = definitionsLoader.load(Path.of(properties.getDefinitionsFile()));
        
        ReconciliationRun run = orchestrator.run(declaration, dryRun);
        lastRun.set(run);
        return run;
    }
    
    public Optional<ReconciliationRun> findLastRun() {
        return Optional.ofNullable(lastRun.get());
    }
    
    public ReconciliationRun getLastRun() {
        return findLastRun().orElseThrow(() -> 
            new ResourceNotFoundException(ErrorCode.RUN_NOT_FOUND, "Reconciliation run", "latest"));
    }
}
