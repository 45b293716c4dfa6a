package com.thesis.tasktree.engine;

import com.thesis.tasktree.exception.DeadlockException;
import com.thesis.tasktree.exception.InvalidConfigurationException;
import com.thesis.tasktree.exception.MalformedTreeException;
import com.thesis.tasktree.exception.TaskTreeException;
import com.thesis.tasktree.model.ScheduleResult;
import com.thesis.tasktree.model.ScheduledTask;
import com.thesis.tasktree.model.SchedulingPolicy;
import com.thesis.tasktree.model.Task;
import com.thesis.tasktree.model.TaskTree;
import com.thesis.tasktree.strategy.SchedulingStrategy;
import com.thesis.tasktree.strategy.Strategies;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Non-preemptive list scheduling of a task tree on identical processors.
 * 
 * Processors are modelled as capacity slots. Each iteration:
 * 1. Orders the ready queue with the policy's strategy
 * 2. Fills free slots from the head of the ready queue
 * 3. Jumps simulated time to the earliest completion
 * 4. Releases the children of every completed task into the ready queue
 * 
 * A run keeps all of its state locally, so one tree may be scheduled by
 * several callers at once.
 */
public class ListSchedulingEngine {
    
    private static final Logger LOG = LoggerFactory.getLogger(ListSchedulingEngine.class);
    
    public ScheduleResult schedule(TaskTree tree, SchedulingPolicy policy) throws TaskTreeException {
        return schedule(tree.getRoot(), tree.getProcessorCount(), policy);
    }
    
    /**
     * Simulate the tree under {@code root} on {@code processorCount} processors.
     * 
     * @return makespan, completion order and per-task start/finish times
     * @throws InvalidConfigurationException if processorCount < 1
     * @throws MalformedTreeException if root has a parent or a task is reachable twice
     * @throws DeadlockException if the run ends before every task completed
     */
    public ScheduleResult schedule(Task root, int processorCount, SchedulingPolicy policy)
            throws TaskTreeException {
        if (processorCount < 1) {
            throw new InvalidConfigurationException("Processor count must be >= 1, got " + processorCount);
        }
        if (!root.isRoot()) {
            throw new MalformedTreeException("Task " + root.getToken() + " is not a root, it depends on "
                + root.getParent().getToken());
        }
        
        SchedulingStrategy strategy = Strategies.forPolicy(policy);
        List<Task> tasks = collectTasks(root);
        
        // Each task has at most one parent, so readiness is a single flag
        Map<Task, Boolean> waiting = new IdentityHashMap<>();
        List<Task> ready = new ArrayList<>();
        for (Task task : tasks) {
            boolean hasParent = !task.isRoot();
            waiting.put(task, hasParent);
            if (!hasParent) {
                ready.add(task);
            }
        }
        
        List<RunningTask> running = new ArrayList<>();
        List<ScheduledTask> trace = new ArrayList<>(tasks.size());
        long totalTime = 0;
        int peakRunning = 0;
        int iterations = 0;
        
        while (!ready.isEmpty() || !running.isEmpty()) {
            // Every iteration completes at least one task. Unreachable while
            // Task.addChild keeps one parent per task
            if (++iterations > tasks.size()) {
                throw new DeadlockException(trace.size(), tasks.size());
            }
            
            strategy.orderReadyQueue(ready);
            
            while (running.size() < processorCount && !ready.isEmpty()) {
                Task next = ready.remove(0);
                running.add(new RunningTask(next, totalTime));
            }
            peakRunning = Math.max(peakRunning, running.size());
            
            if (running.isEmpty()) {
                break;
            }
            
            long delta = Long.MAX_VALUE;
            for (RunningTask item : running) {
                delta = Math.min(delta, item.remaining);
            }
            totalTime += delta;
            
            List<RunningTask> completed = new ArrayList<>();
            List<RunningTask> stillRunning = new ArrayList<>();
            for (RunningTask item : running) {
                item.remaining -= delta;
                if (item.remaining == 0) {
                    completed.add(item);
                } else {
                    stillRunning.add(item);
                }
            }
            running = stillRunning;
            
            for (RunningTask item : completed) {
                Task task = item.task;
                trace.add(new ScheduledTask(task.getName(), task.getDuration(), item.startTime, totalTime));
                for (Task child : task.getChildren()) {
                    if (Boolean.TRUE.equals(waiting.put(child, Boolean.FALSE))) {
                        ready.add(child);
                    }
                }
            }
            
            LOG.debug("[Engine] t={} (+{}) completed={} running={} ready={}",
                totalTime, delta, completed.size(), running.size(), ready.size());
        }
        
        if (trace.size() != tasks.size()) {
            throw new DeadlockException(trace.size(), tasks.size());
        }
        
        LOG.debug("[Engine] {} finished {} tasks on {} processors in {} time units",
            policy, tasks.size(), processorCount, totalTime);
        return new ScheduleResult(policy, processorCount, totalTime, trace, peakRunning);
    }
    
    /**
     * Flatten the tree, rejecting any task reachable along more than one path.
     * Task.addChild already refuses a second parent, so this only fails if
     * that invariant is broken.
     */
    private List<Task> collectTasks(Task root) throws MalformedTreeException {
        Map<Task, Boolean> seen = new IdentityHashMap<>();
        List<Task> tasks = TaskTree.preOrder(root);
        for (Task task : tasks) {
            if (seen.put(task, Boolean.TRUE) != null) {
                throw new MalformedTreeException("Task " + task.getToken() + " is reachable more than once");
            }
        }
        return tasks;
    }
    
    /**
     * A task occupying a processor slot.
     */
    private static final class RunningTask {
        private final Task task;
        private final long startTime;
        private long remaining;
        
        RunningTask(Task task, long startTime) {
            this.task = task;
            this.startTime = startTime;
            this.remaining = task.getDuration();
        }
    }
}
