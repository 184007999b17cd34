package com.branchlifecycle.reconciler.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PrStatus {
    private int number;
    private String state;   // open, closed, merged, draft
    private String title;
    private String url;
}
