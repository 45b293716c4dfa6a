package com.thesis.tasktree.model;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Makespan and completion order of one simulation run.
 */
public class ScheduleResult {
    
    private final SchedulingPolicy policy;
    private final int processorCount;
    private final long totalTime;
    private final List<ScheduledTask> trace;
    private final int peakRunning;
    
    public ScheduleResult(SchedulingPolicy policy, int processorCount, long totalTime,
                          List<ScheduledTask> trace, int peakRunning) {
        this.policy = policy;
        this.processorCount = processorCount;
        this.totalTime = totalTime;
        this.trace = Collections.unmodifiableList(trace);
        this.peakRunning = peakRunning;
    }
    
    public SchedulingPolicy getPolicy() {
        return policy;
    }
    
    public int getProcessorCount() {
        return processorCount;
    }
    
    /**
     * Makespan in simulated time units.
     */
    public long getTotalTime() {
        return totalTime;
    }
    
    /**
     * Task names in completion order.
     */
    public List<String> getOrder() {
        return trace.stream()
            .map(ScheduledTask::getTaskName)
            .collect(Collectors.toList());
    }
    
    /**
     * One entry per task, in completion order.
     */
    public List<ScheduledTask> getTrace() {
        return trace;
    }
    
    /**
     * Largest number of tasks that were running at the same time.
     */
    public int getPeakRunning() {
        return peakRunning;
    }
    
    @Override
    public String toString() {
        return String.format("ScheduleResult{policy=%s, procs=%d, time=%d, order=%s}",
            policy, processorCount, totalTime, getOrder());
    }
}
