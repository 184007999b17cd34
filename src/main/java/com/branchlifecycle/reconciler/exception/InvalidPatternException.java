package com.branchlifecycle.reconciler.exception;

public class InvalidPatternException extends InvalidRuleException {

    private final String pattern;

    public InvalidPatternException(String pattern, String message) {
        super(message);
        this.pattern = pattern;
    }

    public String getPattern() {
        return pattern;
    }
}
