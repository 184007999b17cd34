package com.branchlifecycle.reconciler.service;

import com.branchlifecycle.reconciler.model.BranchSnapshot;
import com.branchlifecycle.reconciler.model.HealthAssessment;
import com.branchlifecycle.reconciler.model.HealthStatus;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scores a branch from 0 to 100. Pure: the result depends only on the snapshot and the stale threshold.
 */
@Service
public class HealthClassifier {

    private static final List<Pattern> ISSUE_PATTERNS = List.of(
        Pattern.compile("(?:^|/)(#?\\d+)(?:[-_]|$)"),
        Pattern.compile("(?:^|/)([A-Z]+-\\d+)(?:[-_]|$)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("(?:^|/)(GH-\\d+)(?:[-_]|$)", Pattern.CASE_INSENSITIVE)
    );

    // Age past which the reason string mentions age, independent of the stale threshold.
    private static final int REASON_AGE_DAYS = 60;

    public HealthAssessment assess(BranchSnapshot branch, int staleDays) {
        int score = score(branch, staleDays);
        return new HealthAssessment(score, HealthStatus.fromScore(score), reason(branch));
    }

    public int score(BranchSnapshot branch, int staleDays) {
        int score = 100;

        if (branch.isMerged()) {
            score -= 40;
        }

        int days = branch.getDaysOld();
        if (days > staleDays * 2) {
            score -= 30;
        } else if (days > staleDays) {
            score -= 20;
        } else if (days * 2 > staleDays) {
            score -= 10;
        }

        if (branch.isRemoteGone()) {
            score -= 20;
        }

        if (branch.getBehind() > 50) {
            score -= 10;
        } else if (branch.getBehind() > 20) {
            score -= 5;
        }

        return Math.max(0, Math.min(100, score));
    }

    /**
     * Lists the factors worth telling a user about. Can mention age even when it cost no points.
     */
    public String reason(BranchSnapshot branch) {
        List<String> reasons = new ArrayList<>();
        if (branch.isMerged()) reasons.add("merged");
        if (branch.getDaysOld() > REASON_AGE_DAYS) reasons.add(branch.getDaysOld() + "d old");
        if (branch.isRemoteGone()) reasons.add("remote deleted");
        if (branch.getBehind() > 20) reasons.add(branch.getBehind() + " behind");
        return reasons.isEmpty() ? "active" : String.join(", ", reasons);
    }

    public Optional<String> extractIssue(String branchName) {
        for (Pattern pattern : ISSUE_PATTERNS) {
            Matcher matcher = pattern.matcher(branchName);
            if (matcher.find()) {
                return Optional.of(matcher.group(1));
            }
        }
        return Optional.empty();
    }

    public BranchSnapshot classify(BranchSnapshot branch, int staleDays) {
        HealthAssessment assessment = assess(branch, staleDays);
        return branch.toBuilder()
            .healthScore(assessment.getScore())
            .healthStatus(assessment.getStatus())
            .healthReason(assessment.getReason())
            .build();
    }
}
