package com.branchlifecycle.reconciler.controller;

import com.branchlifecycle.reconciler.model.GoneChoice;
import com.branchlifecycle.reconciler.service.ProposalService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/proposals")
public class ProposalController {

    private final ProposalService proposalService;

    public ProposalController(ProposalService proposalService) {
        this.proposalService = proposalService;
    }

    @GetMapping
    public ResponseEntity<?> pending() {
        return ResponseEntity.ok(proposalService.pending());
    }

    @PostMapping("/{id}/choice")
    public ResponseEntity<?> choose(@PathVariable String id, @RequestBody Map<String, String> body) {
        GoneChoice choice;
        try {
            choice = GoneChoice.valueOf(body.getOrDefault("choice", "").trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "choice must be clean_all, preview or dismiss"));
        }
        return proposalService.answerGone(id, choice)
            ? ResponseEntity.ok(Map.of("status", "accepted"))
            : ResponseEntity.notFound().build();
    }

    @PostMapping("/{id}/selection")
    public ResponseEntity<?> select(@PathVariable String id, @RequestBody Map<String, List<String>> body) {
        List<String> selected = body.getOrDefault("selected", List.of());
        return proposalService.answerSelection(id, selected)
            ? ResponseEntity.ok(Map.of("status", "accepted", "selected", selected.size()))
            : ResponseEntity.notFound().build();
    }
}
