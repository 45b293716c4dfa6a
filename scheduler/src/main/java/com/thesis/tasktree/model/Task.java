package com.thesis.tasktree.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A node of the task tree.
 * 
 * A task may start only after its parent has completed. Children are kept
 * in the order they were attached, which is the order they enter the ready
 * queue and therefore decides ties between equal durations.
 */
public class Task {
    
    private final String name;
    private final int duration;
    private final List<Task> children = new ArrayList<>();
    private Task parent;
    
    public Task(String name, int duration) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Task name must not be empty");
        }
        if (duration < 0) {
            throw new IllegalArgumentException("Task duration must be >= 0: " + duration);
        }
        this.name = name;
        this.duration = duration;
    }
    
    /**
     * Attach a dependent task. The child must not already have a parent.
     */
    public void addChild(Task child) {
        if (child == this) {
            throw new IllegalArgumentException("Task " + getToken() + " cannot depend on itself");
        }
        if (child.parent != null) {
            throw new IllegalStateException("Task " + child.getToken() +
                " already depends on " + child.parent.getToken());
        }
        children.add(child);
        child.parent = this;
    }
    
    // Getters
    public String getName() {
        return name;
    }
    
    public int getDuration() {
        return duration;
    }
    
    public List<Task> getChildren() {
        return Collections.unmodifiableList(children);
    }
    
    public Task getParent() {
        return parent;
    }
    
    public boolean isRoot() {
        return parent == null;
    }
    
    public boolean isLeaf() {
        return children.isEmpty();
    }
    
    /**
     * The "Name_Duration" token this task was read from.
     */
    public String getToken() {
        return name + "_" + duration;
    }
    
    @Override
    public String toString() {
        return name + "(" + duration + ")";
    }
}
