package com.thesis.tasktree.strategy;

import com.thesis.tasktree.model.SchedulingPolicy;
import com.thesis.tasktree.model.Task;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class StrategiesTest {
    
    private static List<Task> queue() {
        List<Task> ready = new ArrayList<>();
        ready.add(new Task("A", 3));
        ready.add(new Task("B", 1));
        ready.add(new Task("C", 3));
        ready.add(new Task("D", 1));
        ready.add(new Task("E", 2));
        return ready;
    }
    
    private static List<String> names(List<Task> tasks) {
        return tasks.stream().map(Task::getName).collect(Collectors.toList());
    }
    
    @Test
    void shortestFirstKeepsArrivalOrderOnTies() {
        List<Task> ready = queue();
        new ShortestFirstStrategy().orderReadyQueue(ready);
        assertEquals(List.of("B", "D", "E", "A", "C"), names(ready));
    }
    
    @Test
    void longestFirstKeepsArrivalOrderOnTies() {
        List<Task> ready = queue();
        new LongestFirstStrategy().orderReadyQueue(ready);
        assertEquals(List.of("A", "C", "E", "B", "D"), names(ready));
    }
    
    @Test
    void registryHasOneStrategyPerPolicy() {
        for (SchedulingPolicy policy : SchedulingPolicy.values()) {
            assertEquals(policy, Strategies.forPolicy(policy).getPolicy());
        }
    }
}
