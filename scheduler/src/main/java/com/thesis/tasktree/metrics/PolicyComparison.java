package com.thesis.tasktree.metrics;

import com.thesis.tasktree.model.PolicyVerdict;
import com.thesis.tasktree.model.ScheduleResult;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Both policies run on the same tree, and which one finished first.
 */
public class PolicyComparison {
    
    private final String source;
    private final TreeStatistics statistics;
    private final ScheduleResult ascending;
    private final ScheduleResult descending;
    
    public PolicyComparison(String source, TreeStatistics statistics,
                            ScheduleResult ascending, ScheduleResult descending) {
        this.source = source;
        this.statistics = statistics;
        this.ascending = ascending;
        this.descending = descending;
    }
    
    public String getSource() {
        return source;
    }
    
    public TreeStatistics getStatistics() {
        return statistics;
    }
    
    public ScheduleResult getAscending() {
        return ascending;
    }
    
    public ScheduleResult getDescending() {
        return descending;
    }
    
    public PolicyVerdict getBestPolicy() {
        long ascendingTime = ascending.getTotalTime();
        long descendingTime = descending.getTotalTime();
        if (ascendingTime == descendingTime) {
            return PolicyVerdict.TIE;
        }
        return ascendingTime > descendingTime ? PolicyVerdict.DESCENDING : PolicyVerdict.ASCENDING;
    }
    
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("file", source);
        map.put("proc", statistics.getProcessorCount());
        map.put("task_count", statistics.getTaskCount());
        map.put("best_policy", getBestPolicy().name());
        map.put("descending_time", descending.getTotalTime());
        map.put("ascending_time", ascending.getTotalTime());
        map.put("duration_sum", statistics.getDurationSum());
        map.put("proc_task_ratio", statistics.getTasksPerProcessor());
        map.put("mean_task_time", statistics.getMeanDuration());
        return map;
    }
    
    @Override
    public String toString() {
        return toMap().toString();
    }
}
