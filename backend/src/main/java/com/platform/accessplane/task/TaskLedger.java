package com.platform.accessplane.task;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Insertion-ordered task store for a single reconciliation run.
 * 
 * Tasks are keyed by a sequence number assigned on insertion. Status changes follow
 * {@link TaskStatus}: a task is resolved once and never revisited. All writes are
 * serialized so effector calls may later run concurrently.
 */
@Slf4j
public class TaskLedger {
    
    private final Map<Integer, Task> tasks = new LinkedHashMap<>();
    
    /**
     * Append a task and return its sequence number.
     */
    public synchronized int add(Task task) {
        int key = tasks.size();
        tasks.put(key, task);
        return key;
    }
    
    /**
     * Append all tasks in order and return their sequence numbers.
     */
    public synchronized List<Integer> addAll(Collection<Task> newTasks) {
        List<Integer> keys = new ArrayList<>(newTasks.size());
        for (Task task : newTasks) {
            keys.add(add(task));
        }
        return keys;
    }
    
    public synchronized Task get(int key) {
        Task task = tasks.get(key);
        if (task == null) {
            throw new IllegalArgumentException("No task with key " + key);
        }
        return task;
    }
    
    /**
     * Resolve a task. The payload replaces the current one when non-null.
     *
     * @throws IllegalStateException if the task was already resolved or the target is not terminal
     */
    public synchronized Task setStatus(int key, TaskStatus status, String message, TaskPayload payload) {
        Task task = get(key);
        if (!task.getStatus().canTransitionTo(status)) {
            throw new IllegalStateException(String.format(
                "Task %d cannot move from %s to %s", key, task.getStatus(), status));
        }
        task.resolve(status, message, payload);
        log.info("Task {} {} {}: {} ({})", 
            key, task.getTaskType().label(), task.getObjectType().label(), status.label(), message);
        return task;
    }
    
    public Task setStatus(int key, TaskStatus status, String message) {
        return setStatus(key, status, message, null);
    }
    
    /**
     * Tasks still waiting to be executed, in insertion order.
     */
    public synchronized Map<Integer, Task> selectPending() {
        return select(task -> task.getStatus() == TaskStatus.NOT_STARTED);
    }
    
    public synchronized Map<Integer, Task> filter(Set<TaskType> taskTypes) {
        return select(task -> taskTypes.contains(task.getTaskType()));
    }
    
    public synchronized Map<Integer, Task> filter(ObjectType objectType) {
        return select(task -> task.getObjectType() == objectType);
    }
    
    public synchronized Map<Integer, Task> all() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(tasks));
    }
    
    public synchronized int size() {
        return tasks.size();
    }
    
    public synchronized Map<TaskStatus, Long> countByStatus() {
        return tasks.values().stream()
            .collect(Collectors.groupingBy(Task::getStatus, Collectors.counting()));
    }
    
    private Map<Integer, Task> select(Predicate<Task> predicate) {
        Map<Integer, Task> selected = new LinkedHashMap<>();
        tasks.forEach((key, task) -> {
            if (predicate.test(task)) {
                selected.put(key, task);
            }
        });
        return Collections.unmodifiableMap(selected);
    }
}
