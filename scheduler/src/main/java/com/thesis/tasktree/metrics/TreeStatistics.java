package com.thesis.tasktree.metrics;

import com.thesis.tasktree.model.Task;
import com.thesis.tasktree.model.TaskTree;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static figures of a task tree that do not depend on the policy.
 * 
 * Includes the lower bound every schedule must respect:
 * max(critical path, ceil(total work / processors)).
 */
public class TreeStatistics {
    
    private final int taskCount;
    private final long durationSum;
    private final int maxDuration;
    private final long criticalPath;
    private final int processorCount;
    
    private TreeStatistics(int taskCount, long durationSum, int maxDuration,
                           long criticalPath, int processorCount) {
        this.taskCount = taskCount;
        this.durationSum = durationSum;
        this.maxDuration = maxDuration;
        this.criticalPath = criticalPath;
        this.processorCount = processorCount;
    }
    
    public static TreeStatistics of(TaskTree tree) {
        return of(tree.getRoot(), tree.getProcessorCount());
    }
    
    public static TreeStatistics of(Task root, int processorCount) {
        List<Task> tasks = TaskTree.preOrder(root);
        
        long sum = 0;
        int max = 0;
        long longestPath = 0;
        // Pre-order visits a parent before its children
        Map<Task, Long> pathTo = new IdentityHashMap<>();
        for (Task task : tasks) {
            sum += task.getDuration();
            max = Math.max(max, task.getDuration());
            
            long inherited = task.isRoot() ? 0L : pathTo.getOrDefault(task.getParent(), 0L);
            long path = inherited + task.getDuration();
            pathTo.put(task, path);
            longestPath = Math.max(longestPath, path);
        }
        return new TreeStatistics(tasks.size(), sum, max, longestPath, processorCount);
    }
    
    public int getTaskCount() {
        return taskCount;
    }
    
    public long getDurationSum() {
        return durationSum;
    }
    
    public int getMaxDuration() {
        return maxDuration;
    }
    
    /**
     * Longest root-to-leaf sum of durations.
     */
    public long getCriticalPath() {
        return criticalPath;
    }
    
    public int getProcessorCount() {
        return processorCount;
    }
    
    /**
     * Mean duration per task, rounded to 2 decimals.
     */
    public double getMeanDuration() {
        if (taskCount == 0) {
            return 0.0;
        }
        return round((double) durationSum / taskCount);
    }
    
    /**
     * Tasks per processor, rounded to 2 decimals.
     */
    public double getTasksPerProcessor() {
        return round((double) taskCount / processorCount);
    }
    
    /**
     * No schedule on this many processors can finish earlier than this.
     */
    public long getMakespanLowerBound() {
        long workBound = (durationSum + processorCount - 1) / processorCount;
        return Math.max(criticalPath, workBound);
    }
    
    /**
     * Half-even rounding of the exact binary value, so 2.675 (stored as
     * 2.67499...) rounds to 2.67.
     */
    static double round(double value) {
        return new BigDecimal(value).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
    }
}
