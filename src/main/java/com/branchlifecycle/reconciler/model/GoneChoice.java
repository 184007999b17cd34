package com.branchlifecycle.reconciler.model;

/**
 * Answer to the gone-branch prompt.
 */
public enum GoneChoice {
    CLEAN_ALL,
    PREVIEW,
    DISMISS
}
