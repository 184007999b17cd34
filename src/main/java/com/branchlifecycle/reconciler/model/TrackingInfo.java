package com.branchlifecycle.reconciler.model;

import lombok.Value;

@Value
public class TrackingInfo {
    String remoteRef;
    boolean gone;
}
