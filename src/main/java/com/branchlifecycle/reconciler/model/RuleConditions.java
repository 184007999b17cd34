package com.branchlifecycle.reconciler.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Conjunction of optional conditions. An absent (null) condition does not constrain the match.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RuleConditions {
    private Boolean merged;
    private Integer olderThanDays;
    private String pattern;
    private Boolean noRemote;

    @JsonIgnore
    public boolean isEmpty() {
        return merged == null
            && olderThanDays == null
            && (pattern == null || pattern.isEmpty())
            && !Boolean.TRUE.equals(noRemote);
    }
}
