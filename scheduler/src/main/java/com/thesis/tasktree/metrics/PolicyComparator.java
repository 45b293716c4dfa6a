package com.thesis.tasktree.metrics;

import com.thesis.tasktree.engine.ListSchedulingEngine;
import com.thesis.tasktree.exception.TaskTreeException;
import com.thesis.tasktree.model.ScheduleResult;
import com.thesis.tasktree.model.SchedulingPolicy;
import com.thesis.tasktree.model.Task;
import com.thesis.tasktree.model.TaskTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a tree under both policies and reports the winner.
 */
public class PolicyComparator {
    
    private static final Logger LOG = LoggerFactory.getLogger(PolicyComparator.class);
    
    private final ListSchedulingEngine engine;
    
    public PolicyComparator(ListSchedulingEngine engine) {
        this.engine = engine;
    }
    
    public PolicyComparison compare(TaskTree tree) throws TaskTreeException {
        return compare(tree.getSource(), tree.getRoot(), tree.getProcessorCount());
    }
    
    public PolicyComparison compare(String source, Task root, int processorCount) throws TaskTreeException {
        ScheduleResult ascending = engine.schedule(root, processorCount, SchedulingPolicy.ASCENDING);
        ScheduleResult descending = engine.schedule(root, processorCount, SchedulingPolicy.DESCENDING);
        
        PolicyComparison comparison = new PolicyComparison(source,
            TreeStatistics.of(root, processorCount), ascending, descending);
        LOG.info("[Comparator] {}: ASCENDING={} DESCENDING={} best={}", source,
            ascending.getTotalTime(), descending.getTotalTime(), comparison.getBestPolicy());
        return comparison;
    }
    
    /**
     * Single run with one policy, summarised for reporting.
     */
    public ScheduleReport report(TaskTree tree, SchedulingPolicy policy) throws TaskTreeException {
        ScheduleResult result = engine.schedule(tree, policy);
        return new ScheduleReport(tree.getSource(), TreeStatistics.of(tree), result);
    }
}
