package com.branchlifecycle.reconciler.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PendingProposal {
    private String id;
    private String repoPath;
    private ProposalKind kind;
    private String message;
    private List<String> branches;
    private Instant createdAt;
    @JsonIgnore
    private transient CompletableFuture<GoneChoice> choice;
    @JsonIgnore
    private transient CompletableFuture<List<String>> selection;
}
