package com.thesis.tasktree.strategy;

import com.thesis.tasktree.model.SchedulingPolicy;
import com.thesis.tasktree.model.Task;

import java.util.List;

/**
 * Interface for ready-queue ordering strategies
 * 
 * Each strategy implements a different priority rule for deciding which
 * ready task is handed to the next free processor.
 */
public interface SchedulingStrategy {
    
    /**
     * Reorder the ready queue in place, head first.
     * 
     * Implementations must be stable: tasks that compare equal keep the
     * order in which they became ready.
     * 
     * @param readyQueue Tasks whose parent has completed
     */
    void orderReadyQueue(List<Task> readyQueue);
    
    /**
     * Get the policy this strategy implements
     */
    SchedulingPolicy getPolicy();
}
