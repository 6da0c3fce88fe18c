package com.smarttest.core.recovery;

import java.util.regex.Pattern;

/**
 * Maps error messages matching {@code pattern} to {@code category}.
 * Patterns are matched against the lower-cased message.
 */
public record ClassificationRule(ErrorCategory category, Pattern pattern) {

    public static ClassificationRule of(ErrorCategory category, String regex) {
        return new ClassificationRule(category, Pattern.compile(regex));
    }

    public boolean matches(String lowerCaseMessage) {
        return pattern.matcher(lowerCaseMessage).find();
    }
}
