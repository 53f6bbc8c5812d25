package com.platform.accessplane.observability;

import com.platform.accessplane.error.ErrorCode;
import com.platform.accessplane.task.Task;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer meters for reconciliation runs and the tasks they execute.
 */
@Slf4j
@Component
public class ReconciliationMetrics {
    
    static final String TASKS = "accessplane.tasks";
    static final String RUN_DURATION = "accessplane.run.duration";
    static final String ERRORS = "accessplane.errors";
    
    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final Map<String, Timer> timers = new ConcurrentHashMap<>();
    
    public ReconciliationMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }
    
    /**
     * Counts a task by its final status.
     */
    public void recordTask(Task task) {
        String objectType = task.getObjectType().label();
        String taskType = task.getTaskType().label();
        String outcome = task.getStatus().label();
        counters.computeIfAbsent(TASKS + ":" + objectType + ":" + taskType + ":" + outcome, k ->
            Counter.builder(TASKS)
                .tag("object_type", objectType)
                .tag("task_type", taskType)
                .tag("outcome", outcome)
                .register(meterRegistry))
            .increment();
    }
    
    public void recordRun(Duration duration, boolean dryRun) {
        timers.computeIfAbsent(RUN_DURATION + ":" + dryRun, k ->
            Timer.builder(RUN_DURATION)
                .tag("dry_run", String.valueOf(dryRun))
                .register(meterRegistry))
            .record(duration);
        log.debug("Recorded run duration {}ms (dryRun={})", duration.toMillis(), dryRun);
    }
    
    public void recordError(ErrorCode errorCode) {
        counters.computeIfAbsent(ERRORS + ":" + errorCode.getCode(), k ->
            Counter.builder(ERRORS)
                .tag("code", errorCode.getCode())
                .tag("category", errorCode.getCategory().name().toLowerCase())
                .register(meterRegistry))
            .increment();
    }
}
