package com.smarttest.core.model;

import java.io.Serializable;

/**
 * A single user-level step of a test case.
 */
public record TestStep(
    int stepNumber,
    String action,
    String inputValue
) implements Serializable {}
