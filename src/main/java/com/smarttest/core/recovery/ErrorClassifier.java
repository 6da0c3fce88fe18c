package com.smarttest.core.recovery;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Classifies a failure by scanning its message (and its causes' messages) against an ordered
 * rule list. The first matching rule wins; unmatched errors are {@link ErrorCategory#INTERNAL}.
 */
public class ErrorClassifier {

    public static final List<ClassificationRule> DEFAULT_RULES = List.of(
            ClassificationRule.of(ErrorCategory.TIMEOUT, "timeout|timed out"),
            ClassificationRule.of(ErrorCategory.NETWORK,
                    "network|fetch|econnrefused|connection refused|connection reset|unknown host"),
            ClassificationRule.of(ErrorCategory.PLAYWRIGHT, "playwright|element|selector"),
            ClassificationRule.of(ErrorCategory.AI_AGENT, "claude|codex|\\bai\\b|agent"),
            ClassificationRule.of(ErrorCategory.VALIDATION, "validation|schema|invalid")
    );

    private final List<ClassificationRule> rules;

    public ErrorClassifier() {
        this(DEFAULT_RULES);
    }

    public ErrorClassifier(List<ClassificationRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public ErrorCategory classify(Throwable error) {
        String message = describe(error);
        for (ClassificationRule rule : rules) {
            if (rule.matches(message)) {
                return rule.category();
            }
        }
        return ErrorCategory.INTERNAL;
    }

    private static String describe(Throwable error) {
        var parts = new ArrayList<String>();
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 10) {
            if (current.getMessage() != null) {
                parts.add(current.getMessage());
            }
            current = current.getCause();
        }
        return String.join(" | ", parts).toLowerCase(Locale.ROOT);
    }
}
