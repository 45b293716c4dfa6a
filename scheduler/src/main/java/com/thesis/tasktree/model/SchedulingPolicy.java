package com.thesis.tasktree.model;

import java.util.Locale;

/**
 * Ordering applied to the ready queue before free processors are filled
 */
public enum SchedulingPolicy {
    ASCENDING,      // Shortest duration first ("MIN")
    DESCENDING;     // Longest duration first ("MAX")
    
    /**
     * Resolve a policy name, accepting the MIN/MAX aliases.
     * 
     * @throws IllegalArgumentException for an unknown name
     */
    public static SchedulingPolicy parse(String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        switch (normalized) {
            case "MIN":
                return ASCENDING;
            case "MAX":
                return DESCENDING;
            default:
                return SchedulingPolicy.valueOf(normalized);
        }
    }
}
