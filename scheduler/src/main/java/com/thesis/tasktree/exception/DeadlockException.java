package com.thesis.tasktree.exception;

/**
 * The simulation stopped making progress before every task completed.
 */
public class DeadlockException extends TaskTreeException {

    private final int completed;
    private final int expected;

    public DeadlockException(int completed, int expected) {
        super(String.format("simulation stalled after %d of %d tasks", completed, expected));
        this.completed = completed;
        this.expected = expected;
    }

    public int getCompleted() {
        return completed;
    }

    public int getExpected() {
        return expected;
    }
}
