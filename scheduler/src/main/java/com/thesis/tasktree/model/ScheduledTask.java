package com.thesis.tasktree.model;

/**
 * Records when a task ran during a simulation
 */
public class ScheduledTask {
    
    private final String taskName;
    private final int duration;
    private final long startTime;
    private final long finishTime;
    
    public ScheduledTask(String taskName, int duration, long startTime, long finishTime) {
        this.taskName = taskName;
        this.duration = duration;
        this.startTime = startTime;
        this.finishTime = finishTime;
    }
    
    // Getters
    public String getTaskName() {
        return taskName;
    }
    
    public int getDuration() {
        return duration;
    }
    
    public long getStartTime() {
        return startTime;
    }
    
    public long getFinishTime() {
        return finishTime;
    }
    
    @Override
    public String toString() {
        return String.format("ScheduledTask{task='%s', duration=%d, start=%d, finish=%d}",
            taskName, duration, startTime, finishTime);
    }
}
