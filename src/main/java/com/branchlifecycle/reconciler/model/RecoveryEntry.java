package com.branchlifecycle.reconciler.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecoveryEntry {
    private String branchName;
    private String commitHash;
    private Instant deletedAt;
    private String deletedBy;
    private String reason;

    public boolean matches(String name, String hash) {
        return branchName != null && branchName.equals(name)
            && commitHash != null && commitHash.equals(hash);
    }
}
