package com.platform.accessplane.reconciliation;

import com.platform.accessplane.task.TaskLedger;
import com.platform.accessplane.task.TaskStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Outcome of one reconciliation run.
 */
public record ReconciliationRun(
    String runId,
    boolean dryRun,
    Instant startedAt,
    Instant finishedAt,
    TaskLedger ledger
) {
    
    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }
    
    public Map<TaskStatus, Long> summary() {
        return ledger.countByStatus();
    }
    
    public boolean hasFailures() {
        return summary().getOrDefault(TaskStatus.FAILED, 0L) > 0;
    }
}
