package com.machina.provisioning.terraform;

import com.machina.provisioning.entity.LogLevel;
import com.machina.provisioning.entity.LogSource;

/**
 * Receives log lines as they are produced by a running operation.
 */
@FunctionalInterface
public interface LogSink {

    LogSink NOOP = (level, source, message) -> { };

    void append(LogLevel level, LogSource source, String message);

    default void info(String message) {
        append(LogLevel.INFO, LogSource.SYSTEM, message);
    }

    default void warn(String message) {
        append(LogLevel.WARN, LogSource.SYSTEM, message);
    }

    default void error(String message) {
        append(LogLevel.ERROR, LogSource.SYSTEM, message);
    }
}
