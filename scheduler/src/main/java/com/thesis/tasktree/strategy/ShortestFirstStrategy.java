package com.thesis.tasktree.strategy;

import com.thesis.tasktree.model.SchedulingPolicy;
import com.thesis.tasktree.model.Task;

import java.util.Comparator;
import java.util.List;

/**
 * Shortest-First Strategy
 * 
 * Hands the shortest ready task to the next free processor.
 */
public class ShortestFirstStrategy implements SchedulingStrategy {
    
    @Override
    public void orderReadyQueue(List<Task> readyQueue) {
        // List.sort is stable
        readyQueue.sort(Comparator.comparingInt(Task::getDuration));
    }
    
    @Override
    public SchedulingPolicy getPolicy() {
        return SchedulingPolicy.ASCENDING;
    }
}
