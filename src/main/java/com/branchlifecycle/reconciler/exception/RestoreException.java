package com.branchlifecycle.reconciler.exception;

public abstract class RestoreException extends Exception {

    private final String branchName;
    private final String commitHash;

    protected RestoreException(String branchName, String commitHash, String message) {
        super(message);
        this.branchName = branchName;
        this.commitHash = commitHash;
    }

    public String getBranchName() {
        return branchName;
    }

    public String getCommitHash() {
        return commitHash;
    }
}
