package com.platform.accessplane.task;

import java.util.Map;
import java.util.Set;

/**
 * Fixed-width text rendering of a ledger, one row per task.
 */
public final class LedgerReport {
    
    private static final String ROW_FORMAT = "%-3s %-10s %-17s %-15s %-40s %s";
    private static final String RULE = "=".repeat(80);
    
    private LedgerReport() {
    }
    
    public static String render(TaskLedger ledger, Set<TaskType> taskTypes) {
        StringBuilder out = new StringBuilder();
        out.append(RULE).append('\n');
        out.append(String.format(ROW_FORMAT, 
            "S#", "Task Type", "Object Type", "Current Status", "Status Message", "Object Payload"));
        out.append('\n');
        for (Map.Entry<Integer, Task> entry : ledger.filter(taskTypes).entrySet()) {
            out.append(row(entry.getKey(), entry.getValue())).append('\n');
        }
        out.append(RULE);
        return out.toString();
    }
    
    public static String render(TaskLedger ledger) {
        return render(ledger, Set.of(TaskType.values()));
    }
    
    public static String row(int key, Task task) {
        return String.format(ROW_FORMAT,
            key,
            task.getTaskType().label(),
            task.getObjectType().label(),
            task.getStatus().label(),
            task.getStatusMessage(),
            task.getPayload());
    }
}
