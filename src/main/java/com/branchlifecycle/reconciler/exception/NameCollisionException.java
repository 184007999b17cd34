package com.branchlifecycle.reconciler.exception;

public class NameCollisionException extends RestoreException {

    public NameCollisionException(String branchName, String commitHash) {
        super(branchName, commitHash, String.format(
            "Cannot restore %s: a branch with that name already exists", branchName));
    }
}
