package com.platform.accessplane.api;

import com.platform.accessplane.reconciliation.ReconciliationRun;
import com.platform.accessplane.task.Task;
import com.platform.accessplane.task.TaskPayload;
import com.platform.accessplane.task.TaskStatus;
import com.platform.accessplane.task.TaskType;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * JSON view of a reconciliation run and its ledger.
 */
public record RunView(
    String runId,
    boolean dryRun,
    Instant startedAt,
    Instant finishedAt,
    Map<TaskStatus, Long> summary,
    List<TaskView> tasks
) {
    
    public static RunView of(ReconciliationRun run, Set<TaskType> taskTypes) {
        List<TaskView> tasks = run.ledger().filter(taskTypes).entrySet().stream()
            .map(entry -> TaskView.of(entry.getKey(), entry.getValue()))
            .toList();
        return new RunView(run.runId(), run.dryRun(), run.startedAt(), run.finishedAt(), run.summary(), tasks);
    }
    
    public record TaskView(
        int key,
        String taskType,
        String objectType,
        String status,
        String message,
        TaskPayload payload
    ) {
        
        static TaskView of(int key, Task task) {
            return new TaskView(key, 
                task.getTaskType().label(), 
                task.getObjectType().label(),
                task.getStatus().label(),
                task.getStatusMessage(),
                task.getPayload());
        }
    }
}
