package com.branchlifecycle.reconciler.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CleanupRule {
    private String id;
    private String name;
    private boolean enabled;
    @Builder.Default
    private RuleConditions conditions = new RuleConditions();
    @Builder.Default
    private RuleAction action = RuleAction.DELETE;
}
