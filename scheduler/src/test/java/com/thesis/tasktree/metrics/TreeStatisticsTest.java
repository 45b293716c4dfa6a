package com.thesis.tasktree.metrics;

import com.thesis.tasktree.model.Task;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TreeStatisticsTest {
    
    @Test
    void summarisesTree() {
        Task a = new Task("A", 5);
        Task b = new Task("B", 3);
        Task c = new Task("C", 2);
        a.addChild(b);
        a.addChild(c);
        
        TreeStatistics stats = TreeStatistics.of(a, 2);
        
        assertEquals(3, stats.getTaskCount());
        assertEquals(10, stats.getDurationSum());
        assertEquals(5, stats.getMaxDuration());
        assertEquals(8, stats.getCriticalPath());
        assertEquals(3.33, stats.getMeanDuration());
        assertEquals(1.5, stats.getTasksPerProcessor());
        assertEquals(8, stats.getMakespanLowerBound());
    }
    
    @Test
    void workBoundDominatesWideTrees() {
        Task root = new Task("R", 1);
        for (int i = 0; i < 6; i++) {
            root.addChild(new Task("L" + i, 4));
        }
        
        TreeStatistics stats = TreeStatistics.of(root, 4);
        
        assertEquals(5, stats.getCriticalPath());
        // ceil(25 / 4)
        assertEquals(7, stats.getMakespanLowerBound());
        assertEquals(1.75, stats.getTasksPerProcessor());
    }
    
    @Test
    void roundsToTwoDecimals() {
        assertEquals(0.67, TreeStatistics.round(2.0 / 3));
        assertEquals(1.0, TreeStatistics.round(1.0));
        assertEquals(2.67, TreeStatistics.round(107.0 / 40));
        assertEquals(0.01, TreeStatistics.round(1.0 / 200));
    }
    
    @Test
    void meanAndRatioRoundTheExactBinaryValue() {
        // 40 tasks, 107 time units in total: mean 2.675 is stored just below 2.675
        Task root = new Task("T0", 29);
        for (int i = 1; i < 40; i++) {
            root.addChild(new Task("T" + i, 2));
        }
        TreeStatistics mean = TreeStatistics.of(root, 1);
        assertEquals(107, mean.getDurationSum());
        assertEquals(2.67, mean.getMeanDuration());
        
        // 1 / 200 = 0.005 is stored just above 0.005
        TreeStatistics ratio = TreeStatistics.of(new Task("A", 1), 200);
        assertEquals(0.01, ratio.getTasksPerProcessor());
    }
}
