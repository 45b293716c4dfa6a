package com.thesis.tasktree.metrics;

import com.thesis.tasktree.model.ScheduleResult;
import com.thesis.tasktree.model.SchedulingPolicy;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Summary of a single scheduling run, ready for external reporting
 */
public class ScheduleReport {
    
    private final String source;
    private final TreeStatistics statistics;
    private final ScheduleResult result;
    
    public ScheduleReport(String source, TreeStatistics statistics, ScheduleResult result) {
        this.source = source;
        this.statistics = statistics;
        this.result = result;
    }
    
    // Getters
    public String getSource() {
        return source;
    }
    
    public TreeStatistics getStatistics() {
        return statistics;
    }
    
    public ScheduleResult getResult() {
        return result;
    }
    
    public SchedulingPolicy getPolicy() {
        return result.getPolicy();
    }
    
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("file", source);
        map.put("proc", statistics.getProcessorCount());
        map.put("policy", result.getPolicy().name());
        map.put("task_count", statistics.getTaskCount());
        map.put("duration_sum", statistics.getDurationSum());
        map.put("scheduled_time", result.getTotalTime());
        map.put("proc_task_ratio", statistics.getTasksPerProcessor());
        map.put("mean_task_time", statistics.getMeanDuration());
        return map;
    }
    
    @Override
    public String toString() {
        return toMap().toString();
    }
}
