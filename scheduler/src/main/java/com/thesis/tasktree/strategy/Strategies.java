package com.thesis.tasktree.strategy;

import com.thesis.tasktree.model.SchedulingPolicy;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Registry of the available strategies, one per policy.
 */
public final class Strategies {
    
    private static final Map<SchedulingPolicy, SchedulingStrategy> STRATEGIES = initializeStrategies();
    
    private Strategies() {
    }
    
    public static SchedulingStrategy forPolicy(SchedulingPolicy policy) {
        SchedulingStrategy strategy = STRATEGIES.get(policy);
        if (strategy == null) {
            throw new IllegalArgumentException("No strategy registered for policy " + policy);
        }
        return strategy;
    }
    
    private static Map<SchedulingPolicy, SchedulingStrategy> initializeStrategies() {
        Map<SchedulingPolicy, SchedulingStrategy> map = new EnumMap<>(SchedulingPolicy.class);
        map.put(SchedulingPolicy.ASCENDING, new ShortestFirstStrategy());
        map.put(SchedulingPolicy.DESCENDING, new LongestFirstStrategy());
        return Collections.unmodifiableMap(map);
    }
}
