package com.thesis.tasktree.config;

import com.thesis.tasktree.exception.InvalidConfigurationException;
import com.thesis.tasktree.model.SchedulingPolicy;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Run configuration for the command line scheduler.
 * 
 * Input files come from the positional arguments; everything else is read
 * from the environment:
 * - SCHEDULING_POLICY: ASCENDING/DESCENDING (or MIN/MAX). Unset means compare both.
 * - PROCESSOR_OVERRIDE: replaces the processor count of every file.
 * - SHOW_ORDER: print the completion order (default true).
 */
public class SchedulerConfig {
    
    public static final String POLICY_ENV = "SCHEDULING_POLICY";
    public static final String PROCESSOR_OVERRIDE_ENV = "PROCESSOR_OVERRIDE";
    public static final String SHOW_ORDER_ENV = "SHOW_ORDER";
    
    private final List<Path> inputFiles;
    private final SchedulingPolicy fixedPolicy;
    private final Integer processorOverride;
    private final boolean showOrder;
    
    public SchedulerConfig(List<Path> inputFiles, SchedulingPolicy fixedPolicy,
                           Integer processorOverride, boolean showOrder) {
        this.inputFiles = Collections.unmodifiableList(new ArrayList<>(inputFiles));
        this.fixedPolicy = fixedPolicy;
        this.processorOverride = processorOverride;
        this.showOrder = showOrder;
    }
    
    public static SchedulerConfig fromEnvironment(String[] args) throws InvalidConfigurationException {
        return fromEnvironment(args, System.getenv());
    }
    
    public static SchedulerConfig fromEnvironment(String[] args, Map<String, String> env)
            throws InvalidConfigurationException {
        if (args.length == 0) {
            throw new InvalidConfigurationException("No input files given");
        }
        List<Path> files = new ArrayList<>();
        for (String arg : args) {
            files.add(Paths.get(arg));
        }
        
        SchedulingPolicy policy = null;
        String policyEnv = env.get(POLICY_ENV);
        if (policyEnv != null && !policyEnv.trim().isEmpty()) {
            try {
                policy = SchedulingPolicy.parse(policyEnv);
            } catch (IllegalArgumentException e) {
                throw new InvalidConfigurationException(
                    POLICY_ENV + " must be ASCENDING, DESCENDING, MIN or MAX, got '" + policyEnv + "'", e);
            }
        }
        
        Integer override = null;
        String overrideEnv = env.get(PROCESSOR_OVERRIDE_ENV);
        if (overrideEnv != null && !overrideEnv.trim().isEmpty()) {
            try {
                override = Integer.parseInt(overrideEnv.trim());
            } catch (NumberFormatException e) {
                throw new InvalidConfigurationException(
                    PROCESSOR_OVERRIDE_ENV + " is not an integer: '" + overrideEnv + "'", e);
            }
            if (override < 1) {
                throw new InvalidConfigurationException(
                    PROCESSOR_OVERRIDE_ENV + " must be >= 1, got " + override);
            }
        }
        
        boolean showOrder = Boolean.parseBoolean(env.getOrDefault(SHOW_ORDER_ENV, "true").trim());
        
        return new SchedulerConfig(files, policy, override, showOrder);
    }
    
    // Getters
    public List<Path> getInputFiles() {
        return inputFiles;
    }
    
    /**
     * The single policy to run, or null to compare both.
     */
    public SchedulingPolicy getFixedPolicy() {
        return fixedPolicy;
    }
    
    public boolean isComparisonMode() {
        return fixedPolicy == null;
    }
    
    public Integer getProcessorOverride() {
        return processorOverride;
    }
    
    public boolean isShowOrder() {
        return showOrder;
    }
    
    public void print() {
        System.out.println("==========================================");
        System.out.println("  Task Tree Scheduler");
        System.out.println("==========================================");
        System.out.println("Configuration:");
        System.out.println("  Input files:     " + inputFiles.size());
        if (isComparisonMode()) {
            System.out.println("  Mode:            COMPARE (ASCENDING vs DESCENDING)");
        } else {
            System.out.println("  Mode:            FIXED POLICY (" + fixedPolicy + ")");
        }
        System.out.println("  Processors:      " +
            (processorOverride != null ? processorOverride + " (override)" : "from file"));
        System.out.println("  Show order:      " + (showOrder ? "YES" : "NO"));
        System.out.println("==========================================");
        System.out.println();
    }
}
