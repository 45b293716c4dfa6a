package com.thesis.tasktree.strategy;

import com.thesis.tasktree.model.SchedulingPolicy;
import com.thesis.tasktree.model.Task;

import java.util.Comparator;
import java.util.List;

/**
 * Longest-First Strategy
 * 
 * Hands the longest ready task to the next free processor, so long tasks
 * are not left to run alone at the end.
 */
public class LongestFirstStrategy implements SchedulingStrategy {
    
    @Override
    public void orderReadyQueue(List<Task> readyQueue) {
        readyQueue.sort(Comparator.comparingInt(Task::getDuration).reversed());
    }
    
    @Override
    public SchedulingPolicy getPolicy() {
        return SchedulingPolicy.DESCENDING;
    }
}
