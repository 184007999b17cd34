package com.branchlifecycle.reconciler.exception;

public class ObjectMissingException extends RestoreException {

    public ObjectMissingException(String branchName, String commitHash) {
        super(branchName, commitHash, String.format(
            "Cannot restore %s: commit %s is no longer in the repository", branchName, abbreviate(commitHash)));
    }

    private static String abbreviate(String hash) {
        return hash != null && hash.length() > 7 ? hash.substring(0, 7) : hash;
    }
}
