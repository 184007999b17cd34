package com.branchlifecycle.reconciler.model;

import lombok.Value;

/**
 * Per-ref data returned by one batched for-each-ref call.
 */
@Value
public class RefMetadata {
    String name;
    long commitTimestamp;
    String author;
    String upstream;
    boolean upstreamGone;

    public boolean hasUpstream() {
        return upstream != null && !upstream.isEmpty();
    }
}
