package com.thesis.tasktree;

import com.thesis.tasktree.config.SchedulerConfig;
import com.thesis.tasktree.model.PolicyVerdict;
import com.thesis.tasktree.model.SchedulingPolicy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TaskTreeSchedulerTest {
    
    @TempDir
    Path tempDir;
    
    private Path write(String name, String content) throws Exception {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }
    
    @Test
    void comparesEveryFileAndCountsVerdicts() throws Exception {
        Path tie = write("tie.txt", "# procs=2\nA_5 -> B_3\nA_5 -> C_2\n");
        Path desc = write("desc.txt", "# procs=2\nR_0 -> A_3\nR_0 -> B_2\nR_0 -> C_2\n");
        SchedulerConfig config = new SchedulerConfig(List.of(tie, desc), null, null, true);
        
        TaskTreeScheduler scheduler = new TaskTreeScheduler(config);
        
        assertTrue(scheduler.run());
        assertEquals(2, scheduler.getReports().size());
        assertEquals("TIE", scheduler.getReports().get(0).get("best_policy"));
        assertEquals("DESCENDING", scheduler.getReports().get(1).get("best_policy"));
        assertEquals(1, scheduler.getVerdictCounts().get(PolicyVerdict.TIE));
        assertEquals(1, scheduler.getVerdictCounts().get(PolicyVerdict.DESCENDING));
        scheduler.printStatistics();
    }
    
    @Test
    void fixedPolicyWithProcessorOverride() throws Exception {
        Path file = write("fork.txt", "# procs=2\nA_5 -> B_3\nA_5 -> C_2\n");
        SchedulerConfig config = new SchedulerConfig(List.of(file), SchedulingPolicy.ASCENDING, 1, false);
        
        Map<String, Object> report = new TaskTreeScheduler(config).processFile(file);
        
        assertEquals("ASCENDING", report.get("policy"));
        assertEquals(1, report.get("proc"));
        assertEquals(10L, report.get("scheduled_time"));
        assertEquals(3.0, report.get("proc_task_ratio"));
    }
    
    @Test
    void keepsGoingAfterBadFile() throws Exception {
        Path bad = write("bad.txt", "A_1 -> B_1\nX_1 -> Y_1\n");
        Path missing = tempDir.resolve("missing.txt");
        Path good = write("good.txt", "A_2 -> B_2\n");
        SchedulerConfig config = new SchedulerConfig(List.of(bad, missing, good), null, null, false);
        
        TaskTreeScheduler scheduler = new TaskTreeScheduler(config);
        
        assertFalse(scheduler.run());
        assertEquals(2, scheduler.getFailures().size());
        assertTrue(scheduler.getFailures().get(0).contains("MalformedTreeException"));
        assertTrue(scheduler.getFailures().get(1).contains("cannot read file"));
        assertEquals(1, scheduler.getReports().size());
        assertEquals(4L, scheduler.getReports().get(0).get("ascending_time"));
    }
}
