package com.thesis.tasktree.exception;

/**
 * Base type for every failure raised while loading or scheduling a task tree.
 */
public class TaskTreeException extends Exception {

    public TaskTreeException(String message) {
        super(message);
    }

    public TaskTreeException(String message, Throwable cause) {
        super(message, cause);
    }
}
