package org.configlex.junit.extensions.logging;

/**
 * Log levels that {@link LogWatchExtension} can watch for.
 */
public enum LogLevel {
    INFO,
    WARN,
    ERROR
}
