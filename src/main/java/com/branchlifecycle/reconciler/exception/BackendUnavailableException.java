package com.branchlifecycle.reconciler.exception;

import java.util.List;

/**
 * A git invocation could not start, timed out, or exited non-zero.
 */
public class BackendUnavailableException extends Exception {

    private final List<String> command;

    public BackendUnavailableException(List<String> command, String message) {
        super(String.join(" ", command) + ": " + message);
        this.command = List.copyOf(command);
    }

    public BackendUnavailableException(List<String> command, String message, Throwable cause) {
        super(String.join(" ", command) + ": " + message, cause);
        this.command = List.copyOf(command);
    }

    public List<String> getCommand() {
        return command;
    }
}
