package com.smarttest.core.model;

import java.io.Serializable;

/**
 * A project whose UI is under test.
 */
public record Project(String id, String name) implements Serializable {}
