package com.platform.accessplane.task;

/**
 * Kind of change a task applies to its target object.
 */
public enum TaskType {
    CREATE("create"),
    UPDATE("update"),
    DELETE("delete");
    
    private final String label;
    
    TaskType(String label) {
        this.label = label;
    }
    
    public String label() {
        return label;
    }
}
