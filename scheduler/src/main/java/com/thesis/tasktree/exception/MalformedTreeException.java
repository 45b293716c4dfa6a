package com.thesis.tasktree.exception;

/**
 * The edges parse, but they do not describe a single rooted out-tree
 * (no root, several roots, a task with two parents, a cycle).
 */
public class MalformedTreeException extends TaskTreeException {

    public MalformedTreeException(String message) {
        super(message);
    }
}
