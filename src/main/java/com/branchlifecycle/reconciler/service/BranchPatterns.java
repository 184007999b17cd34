package com.branchlifecycle.reconciler.service;

import com.branchlifecycle.reconciler.exception.InvalidPatternException;

import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

public final class BranchPatterns {

    public static final int MAX_PATTERN_LENGTH = 200;
    public static final int MAX_INPUT_LENGTH = 1000;

    // Shapes prone to catastrophic backtracking.
    private static final List<Pattern> DANGEROUS = List.of(
        Pattern.compile("\\([^)]*[+*]\\)[+*{]"),      // (x+)+, (x*)*
        Pattern.compile("\\([^|]*\\|[^)]*\\)[+*{]"),  // (a|b)+
        Pattern.compile("\\.\\*\\.\\*")               // .*.*
    );

    private static final String GLOB_ESCAPED = ".+^${}()|[]\\";

    private BranchPatterns() {
    }

    public static Pattern compileSafely(String pattern) throws InvalidPatternException {
        if (pattern.length() > MAX_PATTERN_LENGTH) {
            throw new InvalidPatternException(pattern,
                "Pattern too long (max " + MAX_PATTERN_LENGTH + " characters)");
        }
        for (Pattern dangerous : DANGEROUS) {
            if (dangerous.matcher(pattern).find()) {
                throw new InvalidPatternException(pattern,
                    "Pattern contains quantifiers that may cause performance issues");
            }
        }
        try {
            return Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            throw new InvalidPatternException(pattern, "Invalid regex: " + e.getDescription());
        }
    }

    /**
     * Unanchored search, so {@code "^feature/"} and {@code "wip"} both behave as users expect.
     */
    public static boolean matches(Pattern compiled, String input) {
        if (input.length() > MAX_INPUT_LENGTH) {
            return false;
        }
        return compiled.matcher(input).find();
    }

    /**
     * {@code *} matches a run of non-slash characters, {@code ?} exactly one. The whole name must match.
     */
    public static Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder("^");
        for (char c : glob.toCharArray()) {
            if (c == '*') {
                regex.append("[^/]*");
            } else if (c == '?') {
                regex.append("[^/]");
            } else if (GLOB_ESCAPED.indexOf(c) >= 0) {
                regex.append('\\').append(c);
            } else {
                regex.append(c);
            }
        }
        return Pattern.compile(regex.append('$').toString());
    }

    public static boolean isExcluded(String branchName, List<String> exclusionGlobs) {
        return exclusionGlobs.stream().anyMatch(glob -> globToRegex(glob).matcher(branchName).matches());
    }
}
