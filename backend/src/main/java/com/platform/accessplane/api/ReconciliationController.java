package com.platform.accessplane.api;

import com.platform.accessplane.reconciliation.ReconciliationRun;
import com.platform.accessplane.reconciliation.ReconciliationService;
import com.platform.accessplane.task.LedgerReport;
import com.platform.accessplane.task.TaskType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.EnumSet;
import java.util.Set;

/**
 * REST API for triggering reconciliation runs and inspecting the latest ledger.
 */
@Slf4j
@RestController
@RequestMapping("/api/reconciliation")
@RequiredArgsConstructor
public class ReconciliationController {
    
    private final ReconciliationService reconciliationService;
    
    /**
     * Run a reconciliation now. {@code dryRun} overrides the configured mode.
     */
    @PostMapping("/run")
    public ResponseEntity<RunView> run(@RequestParam(required = false) Boolean dryRun) {
        log.info("Reconciliation triggered via API (dryRun={})", dryRun);
        ReconciliationRun run = reconciliationService.reconcile(dryRun);
        return ResponseEntity.ok(RunView.of(run, EnumSet.allOf(TaskType.class)));
    }
    
    /**
     * Tasks of the latest run, optionally limited to some task types.
     */
    @GetMapping("/tasks")
    public ResponseEntity<RunView> getTasks(@RequestParam(required = false) Set<TaskType> taskType) {
        Set<TaskType> types = taskType == null || taskType.isEmpty() ? EnumSet.allOf(TaskType.class) : taskType;
        return ResponseEntity.ok(RunView.of(reconciliationService.getLastRun(), types));
    }
    
    @GetMapping(value = "/report", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> getReport() {
        return ResponseEntity.ok(LedgerReport.render(reconciliationService.getLastRun().ledger()));
    }
}
