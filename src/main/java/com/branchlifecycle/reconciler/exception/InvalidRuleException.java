package com.branchlifecycle.reconciler.exception;

public class InvalidRuleException extends Exception {

    public InvalidRuleException(String message) {
        super(message);
    }
}
