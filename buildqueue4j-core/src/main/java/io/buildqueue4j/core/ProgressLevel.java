package io.buildqueue4j.core;

public enum ProgressLevel {
    INFO,
    WARN,
    ERROR
}
