package org.silc.junit.extensions.logging;

/**
 * Levels that log rules can refer to.
 */
public enum LogLevel {
    INFO,
    WARN,
    ERROR
}
