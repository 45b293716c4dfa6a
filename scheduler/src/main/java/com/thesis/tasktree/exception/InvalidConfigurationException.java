package com.thesis.tasktree.exception;

public class InvalidConfigurationException extends TaskTreeException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
