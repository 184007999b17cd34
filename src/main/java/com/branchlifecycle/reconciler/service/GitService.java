package com.branchlifecycle.reconciler.service;

import com.branchlifecycle.reconciler.exception.BackendUnavailableException;
import com.branchlifecycle.reconciler.model.AheadBehind;
import com.branchlifecycle.reconciler.model.RefMetadata;
import com.branchlifecycle.reconciler.model.TrackingInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.*;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Thin wrapper over the git CLI. Every call either returns the backend's answer or throws
 * {@link BackendUnavailableException}; callers decide how to degrade.
 */
@Slf4j
@Service
public class GitService {

    private static final String REF_FORMAT =
        "%(refname:short)|%(committerdate:unix)|%(authorname)|%(upstream:short)|%(upstream:track)";

    private static final int MAX_ERROR_CHARS = 500;

    private static final Pattern TRACKING_PATTERN =
        Pattern.compile("^[*+]?\\s+(\\S+)\\s+\\S+\\s+\\[([^\\]]+)\\]");

    @Value("${git.command.timeout-seconds:60}")
    private long timeoutSeconds = 60;

    @Value("${git.executable:git}")
    private String gitExecutable = "git";

    public void setTimeoutSeconds(long timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public void setGitExecutable(String gitExecutable) {
        this.gitExecutable = gitExecutable;
    }

    public List<String> listBranches(String repoPath) throws BackendUnavailableException {
        return splitLines(runGit(repoPath, "branch", "--format=%(refname:short)"));
    }

    /**
     * Returns the checked-out branch, or an empty string when HEAD is detached.
     */
    public String currentBranch(String repoPath) throws BackendUnavailableException {
        return runGit(repoPath, "branch", "--show-current").trim();
    }

    public String baseBranch(String repoPath) {
        try {
            String ref = runGit(repoPath, "symbolic-ref", "refs/remotes/origin/HEAD").trim();
            return ref.replace("refs/remotes/origin/", "");
        } catch (BackendUnavailableException e) {
            log.debug("origin/HEAD not set for {}, guessing base branch", repoPath);
        }
        try {
            String remotes = runGit(repoPath, "branch", "-r");
            if (remotes.contains("origin/main")) return "main";
            if (remotes.contains("origin/master")) return "master";
        } catch (BackendUnavailableException e) {
            log.debug("Could not list remote branches for {}: {}", repoPath, e.getMessage());
        }
        return "main";
    }

    public Set<String> mergedBranches(String repoPath, String baseBranch) throws BackendUnavailableException {
        return new HashSet<>(splitLines(
            runGit(repoPath, "branch", "--merged", baseBranch, "--format=%(refname:short)")));
    }

    public Map<String, RefMetadata> refMetadata(String repoPath) throws BackendUnavailableException {
        return parseRefMetadata(runGit(repoPath, "for-each-ref", "--format=" + REF_FORMAT, "refs/heads/"));
    }

    public Map<String, TrackingInfo> trackingInfo(String repoPath) throws BackendUnavailableException {
        return parseTrackingInfo(runGit(repoPath, "branch", "-vv"));
    }

    /**
     * Per-branch fallback for {@link #refMetadata}: committer timestamp and author of the tip.
     */
    public RefMetadata lastCommit(String repoPath, String branch) throws BackendUnavailableException {
        String line = runGit(repoPath, "log", "-1", "--format=%ct|%an", branch).trim();
        String[] parts = line.split("\\|", 2);
        long timestamp = parseLong(parts[0]);
        String author = parts.length > 1 && !parts[1].isEmpty() ? parts[1] : null;
        return new RefMetadata(branch, timestamp, author, null, false);
    }

    public AheadBehind aheadBehind(String repoPath, String baseBranch, String branch)
            throws BackendUnavailableException {
        return parseAheadBehind(runGit(repoPath, "rev-list", "--left-right", "--count",
            baseBranch + "..." + branch));
    }

    public String commitHash(String repoPath, String branch) throws BackendUnavailableException {
        String hash = runGit(repoPath, "rev-parse", "--verify", branch + "^{commit}").trim();
        if (hash.isEmpty()) {
            throw new BackendUnavailableException(List.of("git", "rev-parse", branch), "empty hash");
        }
        return hash;
    }

    public void deleteBranch(String repoPath, String branch) throws BackendUnavailableException {
        runGit(repoPath, "branch", "-D", "--", branch);
    }

    public void createBranchAt(String repoPath, String branch, String commitHash) throws BackendUnavailableException {
        runGit(repoPath, "branch", "--", branch, commitHash);
    }

    public boolean objectExists(String repoPath, String commitHash) {
        return succeeds(repoPath, "cat-file", "-e", commitHash + "^{commit}");
    }

    public boolean branchExists(String repoPath, String branch) {
        return succeeds(repoPath, "show-ref", "--verify", "--quiet", "refs/heads/" + branch);
    }

    public String userName(String repoPath) throws BackendUnavailableException {
        return runGit(repoPath, "config", "user.name").trim();
    }

    public Optional<String> gitRoot(String path) {
        try {
            return Optional.of(runGit(path, "rev-parse", "--show-toplevel").trim());
        } catch (BackendUnavailableException e) {
            return Optional.empty();
        }
    }

    public Map<String, RefMetadata> parseRefMetadata(String output) {
        Map<String, RefMetadata> result = new LinkedHashMap<>();
        for (String line : splitLines(output)) {
            String[] parts = line.split("\\|", -1);
            if (parts.length < 3) continue;
            String upstream = parts.length > 3 ? parts[3] : "";
            String track = parts.length > 4 ? parts[4] : "";
            result.put(parts[0], new RefMetadata(
                parts[0],
                parseLong(parts[1]),
                parts[2].isEmpty() ? null : parts[2],
                upstream.isEmpty() ? null : upstream,
                track.contains("gone")));
        }
        return result;
    }

    public Map<String, TrackingInfo> parseTrackingInfo(String output) {
        Map<String, TrackingInfo> result = new LinkedHashMap<>();
        for (String line : output.split("\n")) {
            Matcher matcher = TRACKING_PATTERN.matcher(line);
            if (matcher.find()) {
                String ref = matcher.group(2);
                result.put(matcher.group(1), new TrackingInfo(ref.split(":")[0], ref.contains(": gone")));
            }
        }
        return result;
    }

    public AheadBehind parseAheadBehind(String output) {
        String[] counts = output.trim().split("\\s+");
        if (counts.length < 2) {
            return AheadBehind.ZERO;
        }
        return new AheadBehind((int) parseLong(counts[1]), (int) parseLong(counts[0]));
    }

    private boolean succeeds(String repoPath, String... args) {
        try {
            runGit(repoPath, args);
            return true;
        } catch (BackendUnavailableException e) {
            return false;
        }
    }

    private String runGit(String repoPath, String... args) throws BackendUnavailableException {
        List<String> command = new ArrayList<>();
        command.add(gitExecutable);
        command.addAll(Arrays.asList(args));

        File stdout = null;
        File stderr = null;
        try {
            stdout = File.createTempFile("git-out", ".txt");
            stderr = File.createTempFile("git-err", ".txt");

            ProcessBuilder pb = new ProcessBuilder(command);
            pb.directory(new File(repoPath));
            pb.redirectOutput(stdout);
            pb.redirectError(stderr);

            Process process = pb.start();
            boolean finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);

            if (!finished) {
                process.destroyForcibly();
                throw new BackendUnavailableException(command, "timed out after " + timeoutSeconds + "s");
            }
            if (process.exitValue() != 0) {
                String errors = errorTail(readFile(stderr));
                throw new BackendUnavailableException(command,
                    "exit " + process.exitValue() + (errors.isBlank() ? "" : ": " + errors));
            }
            log.debug("{} in {} ok", command, repoPath);
            return readFile(stdout);
        } catch (IOException e) {
            throw new BackendUnavailableException(command, e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendUnavailableException(command, "interrupted", e);
        } finally {
            deleteQuietly(stdout);
            deleteQuietly(stderr);
        }
    }

    private String readFile(File file) throws IOException {
        return Files.readString(file.toPath(), StandardCharsets.UTF_8);
    }

    private static String errorTail(String errors) {
        String trimmed = errors.trim();
        return trimmed.length() > MAX_ERROR_CHARS ? trimmed.substring(trimmed.length() - MAX_ERROR_CHARS) : trimmed;
    }

    private static void deleteQuietly(File file) {
        if (file != null && !file.delete() && file.exists()) {
            log.debug("Could not delete temp file {}", file);
        }
    }

    private static List<String> splitLines(String output) {
        List<String> lines = new ArrayList<>();
        for (String line : output.split("\n")) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty()) lines.add(trimmed);
        }
        return lines;
    }

    private static long parseLong(String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return 0L;
        }
    }
}
