package com.platform.accessplane.task;

import java.util.Map;
import java.util.Set;

/**
 * Task lifecycle state.
 * 
 * A task starts as NOT_STARTED and is resolved exactly once, to SUCCESS or FAILED.
 * Resolved states are terminal.
 */
public enum TaskStatus {
    NOT_STARTED("Not Started"),
    SUCCESS("Success"),
    FAILED("Failed");
    
    private static final Map<TaskStatus, Set<TaskStatus>> ALLOWED_TRANSITIONS = Map.of(
        NOT_STARTED, Set.of(SUCCESS, FAILED),
        SUCCESS, Set.of(),
        FAILED, Set.of()
    );
    
    private final String label;
    
    TaskStatus(String label) {
        this.label = label;
    }
    
    public String label() {
        return label;
    }
    
    public boolean canTransitionTo(TaskStatus target) {
        return ALLOWED_TRANSITIONS.get(this).contains(target);
    }
}
