package com.thesis.tasktree;

import com.thesis.tasktree.config.SchedulerConfig;
import com.thesis.tasktree.engine.ListSchedulingEngine;
import com.thesis.tasktree.exception.TaskTreeException;
import com.thesis.tasktree.loader.TreeLoader;
import com.thesis.tasktree.metrics.PolicyComparator;
import com.thesis.tasktree.metrics.PolicyComparison;
import com.thesis.tasktree.metrics.ScheduleReport;
import com.thesis.tasktree.metrics.TreeStatistics;
import com.thesis.tasktree.model.PolicyVerdict;
import com.thesis.tasktree.model.ScheduleResult;
import com.thesis.tasktree.model.TaskTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Command line entry point.
 * 
 * Loads every input file, then either compares the ASCENDING and DESCENDING
 * policies on it or runs the single policy chosen by SCHEDULING_POLICY, and
 * prints one report per file followed by batch statistics.
 */
public class TaskTreeScheduler {
    
    private static final Logger LOG = LoggerFactory.getLogger(TaskTreeScheduler.class);
    
    private final SchedulerConfig config;
    private final TreeLoader loader;
    private final ListSchedulingEngine engine;
    private final PolicyComparator comparator;
    
    private final List<Map<String, Object>> reports = new ArrayList<>();
    private final Map<PolicyVerdict, Integer> verdictCounts = new EnumMap<>(PolicyVerdict.class);
    private final List<String> failures = new ArrayList<>();
    
    public TaskTreeScheduler(SchedulerConfig config) {
        this.config = config;
        this.loader = new TreeLoader();
        this.engine = new ListSchedulingEngine();
        this.comparator = new PolicyComparator(engine);
    }
    
    /**
     * Process every configured file.
     * 
     * @return true if all files were scheduled
     */
    public boolean run() {
        for (Path file : config.getInputFiles()) {
            try {
                processFile(file);
            } catch (IOException e) {
                recordFailure(file, "cannot read file: " + e.getMessage());
            } catch (TaskTreeException e) {
                recordFailure(file, e.getClass().getSimpleName() + ": " + e.getMessage());
            }
        }
        return failures.isEmpty();
    }
    
    /**
     * Load and schedule one file, printing its report.
     */
    Map<String, Object> processFile(Path file) throws IOException, TaskTreeException {
        TaskTree tree = loader.load(file);
        if (config.getProcessorOverride() != null) {
            LOG.info("[Scheduler] Overriding processor count {} -> {} for {}",
                tree.getProcessorCount(), config.getProcessorOverride(), file);
            tree = tree.withProcessorCount(config.getProcessorOverride());
        }
        
        Map<String, Object> report;
        if (config.isComparisonMode()) {
            PolicyComparison comparison = comparator.compare(tree);
            verdictCounts.merge(comparison.getBestPolicy(), 1, Integer::sum);
            report = comparison.toMap();
            printReport(report);
            if (config.isShowOrder()) {
                printOrder(comparison.getAscending());
                printOrder(comparison.getDescending());
            }
            warnIfBelowBound(comparison.getStatistics(), comparison.getAscending());
            warnIfBelowBound(comparison.getStatistics(), comparison.getDescending());
        } else {
            ScheduleReport single = comparator.report(tree, config.getFixedPolicy());
            report = single.toMap();
            printReport(report);
            if (config.isShowOrder()) {
                printOrder(single.getResult());
            }
            warnIfBelowBound(single.getStatistics(), single.getResult());
        }
        reports.add(report);
        return report;
    }
    
    public List<Map<String, Object>> getReports() {
        return Collections.unmodifiableList(reports);
    }
    
    public List<String> getFailures() {
        return Collections.unmodifiableList(failures);
    }
    
    public Map<PolicyVerdict, Integer> getVerdictCounts() {
        return Collections.unmodifiableMap(verdictCounts);
    }
    
    private void recordFailure(Path file, String reason) {
        System.err.println("[ERROR] " + file + ": " + reason);
        LOG.debug("[Scheduler] Failed to schedule {}", file);
        failures.add(file + ": " + reason);
    }
    
    /**
     * A makespan under the lower bound means the engine is broken.
     */
    private void warnIfBelowBound(TreeStatistics statistics, ScheduleResult result) {
        if (result.getTotalTime() < statistics.getMakespanLowerBound()) {
            LOG.warn("[Scheduler] {} makespan {} is below the lower bound {}",
                result.getPolicy(), result.getTotalTime(), statistics.getMakespanLowerBound());
        }
    }
    
    private void printReport(Map<String, Object> report) {
        System.out.println("----------------------------------------");
        for (Map.Entry<String, Object> entry : report.entrySet()) {
            System.out.println(String.format("  %-16s %s", entry.getKey() + ":", entry.getValue()));
        }
    }
    
    private void printOrder(ScheduleResult result) {
        System.out.println(String.format("  %-16s %s", result.getPolicy() + ":", String.join(" ", result.getOrder())));
    }
    
    /**
     * Print batch statistics
     */
    public void printStatistics() {
        System.out.println("\n========================================");
        System.out.println("     SCHEDULING STATISTICS");
        System.out.println("========================================");
        System.out.println("Files Processed: " + reports.size());
        System.out.println("Files Failed: " + failures.size());
        
        if (config.isComparisonMode() && !reports.isEmpty()) {
            System.out.println();
            System.out.println("Best Policy Distribution:");
            for (PolicyVerdict verdict : PolicyVerdict.values()) {
                int count = verdictCounts.getOrDefault(verdict, 0);
                double percentage = (count * 100.0) / reports.size();
                System.out.println("  " + verdict + ": " + count +
                    " (" + String.format("%.1f%%", percentage) + ")");
            }
        }
        System.out.println("========================================\n");
    }
    
    /**
     * Main entry point
     */
    public static void main(String[] args) {
        SchedulerConfig config;
        try {
            config = SchedulerConfig.fromEnvironment(args);
        } catch (TaskTreeException e) {
            System.err.println("FATAL ERROR: " + e.getMessage());
            System.err.println("Usage: TaskTreeScheduler <tree-file> [<tree-file> ...]");
            System.exit(1);
            return;
        }
        
        config.print();
        TaskTreeScheduler scheduler = new TaskTreeScheduler(config);
        boolean ok = scheduler.run();
        scheduler.printStatistics();
        
        if (!ok) {
            System.exit(1);
        }
    }
}
