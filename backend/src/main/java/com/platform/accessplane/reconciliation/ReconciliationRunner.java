package com.platform.accessplane.reconciliation;

import com.platform.accessplane.config.AccessPlaneProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Runs one reconciliation once the application is ready, when enabled.
 */
@Slf4j
@Component
public class ReconciliationRunner {
    
    private final AccessPlaneProperties properties;
    private final ReconciliationService reconciliationService;
    
    public ReconciliationRunner(AccessPlaneProperties properties, ReconciliationService reconciliationService) {
        this.properties = properties;
        this.reconciliationService = reconciliationService;
    }
    
    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady(ApplicationReadyEvent event) {
        if (!properties.isRunOnStartup()) {
            log.info("Startup reconciliation disabled");
            return;
        }
        ReconciliationRun run = reconciliationService.reconcile(null);
        if (run.hasFailures()) {
            log.warn("Startup reconciliation {} finished with failures: {}", run.runId(), run.summary());
        }
    }
}
