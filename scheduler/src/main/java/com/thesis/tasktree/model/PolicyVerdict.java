package com.thesis.tasktree.model;

/**
 * Outcome of comparing both policies on the same tree
 */
public enum PolicyVerdict {
    ASCENDING,
    DESCENDING,
    TIE
}
