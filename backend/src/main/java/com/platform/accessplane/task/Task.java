package com.platform.accessplane.task;

import lombok.Getter;

import java.util.Objects;

/**
 * One unit of reconciliation work. The object type is derived from the payload variant.
 * Status, message and payload are only changed through {@link TaskLedger#setStatus}.
 */
@Getter
public class Task {
    
    static final String WAITING_MESSAGE = "Waiting to start";
    
    private final TaskType taskType;
    private final ObjectType objectType;
    private TaskStatus status;
    private String statusMessage;
    private TaskPayload payload;
    
    public Task(TaskType taskType, TaskPayload payload) {
        this.taskType = Objects.requireNonNull(taskType, "taskType");
        this.payload = Objects.requireNonNull(payload, "payload");
        this.objectType = payload.objectType();
        this.status = TaskStatus.NOT_STARTED;
        this.statusMessage = WAITING_MESSAGE;
    }
    
    public static Task create(TaskPayload payload) {
        return new Task(TaskType.CREATE, payload);
    }
    
    public static Task update(TaskPayload payload) {
        return new Task(TaskType.UPDATE, payload);
    }
    
    public static Task delete(TaskPayload payload) {
        return new Task(TaskType.DELETE, payload);
    }
    
    void resolve(TaskStatus newStatus, String message, TaskPayload newPayload) {
        if (newPayload != null) {
            if (newPayload.objectType() != objectType) {
                throw new IllegalArgumentException(String.format(
                    "Payload of type %s cannot replace %s payload", newPayload.objectType(), objectType));
            }
            this.payload = newPayload;
        }
        this.status = newStatus;
        this.statusMessage = message;
    }
    
    @Override
    public String toString() {
        return String.format("%s %s [%s] %s", 
            taskType.label(), objectType.label(), status.label(), payload);
    }
}
