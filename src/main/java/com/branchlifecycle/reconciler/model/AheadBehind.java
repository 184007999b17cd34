package com.branchlifecycle.reconciler.model;

import lombok.Value;

@Value
public class AheadBehind {
    public static final AheadBehind ZERO = new AheadBehind(0, 0);

    int ahead;
    int behind;
}
