package com.smarttest.core.recovery;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.net.ConnectException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ErrorClassifierTest {

    private final ErrorClassifier classifier = new ErrorClassifier();

    @ParameterizedTest(name = "\"{0}\" -> {1}")
    @CsvSource(delimiter = '|', value = {
            "Navigation timed out after 30000ms | TIMEOUT",
            "Timeout waiting for page load | TIMEOUT",
            "fetch failed | NETWORK",
            "connect ECONNREFUSED 127.0.0.1:3000 | NETWORK",
            "Element #submit is not visible | PLAYWRIGHT",
            "playwright browser crashed | PLAYWRIGHT",
            "Claude returned an empty response | AI_AGENT",
            "AI quota exceeded | AI_AGENT",
            "Output does not match schema | VALIDATION",
            "Invalid test case definition | VALIDATION",
            "NullPointerException in report writer | INTERNAL"
    })
    @DisplayName("classifies by message keywords")
    void classifies(String message, ErrorCategory expected) {
        assertEquals(expected, classifier.classify(new RuntimeException(message)));
    }

    @Test
    @DisplayName("earlier rules win when several match")
    void ruleOrder() {
        assertEquals(ErrorCategory.TIMEOUT,
                classifier.classify(new RuntimeException("timeout while waiting for selector .cart")));
    }

    @Test
    @DisplayName("'ai' must be a whole word")
    void aiWholeWord() {
        assertEquals(ErrorCategory.INTERNAL, classifier.classify(new RuntimeException("disk is unavailable, said the OS")));
    }

    @Test
    @DisplayName("looks at the cause chain")
    void causeChain() {
        var error = new IllegalStateException("step failed", new IOException("wrapped", new ConnectException("Connection refused")));
        assertEquals(ErrorCategory.NETWORK, classifier.classify(error));
    }

    @Test
    @DisplayName("errors without any message are internal")
    void noMessage() {
        assertEquals(ErrorCategory.INTERNAL, classifier.classify(new NullPointerException()));
    }

    @Test
    @DisplayName("custom rule lists replace the defaults")
    void customRules() {
        var custom = new ErrorClassifier(List.of(ClassificationRule.of(ErrorCategory.VALIDATION, "http 4\\d\\d")));
        assertEquals(ErrorCategory.VALIDATION, custom.classify(new RuntimeException("HTTP 422 from API")));
        assertEquals(ErrorCategory.INTERNAL, custom.classify(new RuntimeException("network down")));
    }
}
