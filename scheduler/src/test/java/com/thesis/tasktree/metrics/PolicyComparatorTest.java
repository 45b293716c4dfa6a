package com.thesis.tasktree.metrics;

import com.thesis.tasktree.engine.ListSchedulingEngine;
import com.thesis.tasktree.loader.TreeLoader;
import com.thesis.tasktree.model.PolicyVerdict;
import com.thesis.tasktree.model.SchedulingPolicy;
import com.thesis.tasktree.model.TaskTree;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PolicyComparatorTest {
    
    private TreeLoader loader;
    private PolicyComparator comparator;
    
    @BeforeEach
    void setUp() {
        loader = new TreeLoader();
        comparator = new PolicyComparator(new ListSchedulingEngine());
    }
    
    private TaskTree load(String name) throws Exception {
        return loader.load(Paths.get(getClass().getResource("/trees/" + name).toURI()));
    }
    
    @Test
    @DisplayName("Equal makespans -> TIE")
    void equalMakespansTie() throws Exception {
        PolicyComparison comparison = comparator.compare(load("example.txt"));
        
        assertEquals(8, comparison.getAscending().getTotalTime());
        assertEquals(8, comparison.getDescending().getTotalTime());
        assertEquals(PolicyVerdict.TIE, comparison.getBestPolicy());
    }
    
    @Test
    @DisplayName("Ascending run slower -> DESCENDING")
    void descendingWins() throws Exception {
        PolicyComparison comparison = comparator.compare(load("descending-wins.txt"));
        
        assertEquals(5, comparison.getAscending().getTotalTime());
        assertEquals(4, comparison.getDescending().getTotalTime());
        assertEquals(PolicyVerdict.DESCENDING, comparison.getBestPolicy());
    }
    
    @Test
    @DisplayName("Descending run slower -> ASCENDING")
    void ascendingWins() throws Exception {
        PolicyComparison comparison = comparator.compare(load("ascending-wins.txt"));
        
        assertEquals(6, comparison.getAscending().getTotalTime());
        assertEquals(7, comparison.getDescending().getTotalTime());
        assertEquals(PolicyVerdict.ASCENDING, comparison.getBestPolicy());
    }
    
    @Test
    void comparisonMapHasReportFields() throws Exception {
        TaskTree tree = load("ascending-wins.txt");
        Map<String, Object> map = comparator.compare(tree).toMap();
        
        assertEquals(List.of("file", "proc", "task_count", "best_policy", "descending_time",
            "ascending_time", "duration_sum", "proc_task_ratio", "mean_task_time"), List.copyOf(map.keySet()));
        assertEquals(tree.getSource(), map.get("file"));
        assertEquals(2, map.get("proc"));
        assertEquals(5, map.get("task_count"));
        assertEquals("ASCENDING", map.get("best_policy"));
        assertEquals(7L, map.get("descending_time"));
        assertEquals(6L, map.get("ascending_time"));
        assertEquals(9L, map.get("duration_sum"));
        assertEquals(2.5, map.get("proc_task_ratio"));
        assertEquals(1.8, map.get("mean_task_time"));
    }
    
    @Test
    void singleRunReport() throws Exception {
        ScheduleReport report = comparator.report(load("example.txt"), SchedulingPolicy.DESCENDING);
        Map<String, Object> map = report.toMap();
        
        assertEquals(SchedulingPolicy.DESCENDING, report.getPolicy());
        assertEquals("DESCENDING", map.get("policy"));
        assertEquals(3, map.get("task_count"));
        assertEquals(10L, map.get("duration_sum"));
        assertEquals(8L, map.get("scheduled_time"));
        assertEquals(1.5, map.get("proc_task_ratio"));
        assertEquals(3.33, map.get("mean_task_time"));
    }
    
    @Test
    void singleProcessorAlwaysTies() throws Exception {
        TaskTree tree = load("descending-wins.txt").withProcessorCount(1);
        PolicyComparison comparison = comparator.compare(tree);
        
        assertEquals(7, comparison.getAscending().getTotalTime());
        assertEquals(PolicyVerdict.TIE, comparison.getBestPolicy());
    }
}
