package com.thesis.tasktree.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A loaded task tree: the root, the processor count read alongside it and
 * an index of every task by its "Name_Duration" token.
 */
public class TaskTree {
    
    private final String source;
    private final Task root;
    private final int processorCount;
    private final Map<String, Task> tasksByToken;
    
    public TaskTree(String source, Task root, int processorCount, Map<String, Task> tasksByToken) {
        this.source = source;
        this.root = root;
        this.processorCount = processorCount;
        this.tasksByToken = Collections.unmodifiableMap(new LinkedHashMap<>(tasksByToken));
    }
    
    /**
     * Where the tree was read from (file path or a caller-supplied label).
     */
    public String getSource() {
        return source;
    }
    
    public Task getRoot() {
        return root;
    }
    
    public int getProcessorCount() {
        return processorCount;
    }
    
    /**
     * The same tasks scheduled on a different number of processors.
     */
    public TaskTree withProcessorCount(int processors) {
        return new TaskTree(source, root, processors, tasksByToken);
    }
    
    public int size() {
        return tasksByToken.size();
    }
    
    public Task findTask(String token) {
        return tasksByToken.get(token);
    }
    
    /**
     * Tasks in the order their tokens first appeared in the input.
     */
    public List<Task> getTasks() {
        return new ArrayList<>(tasksByToken.values());
    }
    
    /**
     * Pre-order walk from the root.
     */
    public List<Task> preOrder() {
        return preOrder(root);
    }
    
    /**
     * Pre-order walk of the subtree under {@code start}, children visited in
     * insertion order. Uses an explicit stack so deep chains do not overflow.
     */
    public static List<Task> preOrder(Task start) {
        List<Task> visited = new ArrayList<>();
        Deque<Task> stack = new ArrayDeque<>();
        stack.push(start);
        
        while (!stack.isEmpty()) {
            Task task = stack.pop();
            visited.add(task);
            List<Task> children = task.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return visited;
    }
    
    @Override
    public String toString() {
        return String.format("TaskTree{source='%s', root=%s, procs=%d, tasks=%d}",
            source, root, processorCount, size());
    }
}
