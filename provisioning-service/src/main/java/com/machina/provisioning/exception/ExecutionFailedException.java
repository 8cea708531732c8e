package com.machina.provisioning.exception;

import lombok.Getter;

import java.util.List;

/**
 * External tool exited non-zero (or timed out). Carries the last captured output lines.
 */
@Getter
public class ExecutionFailedException extends RuntimeException {

    private final int exitCode;
    private final List<String> outputTail;

    public ExecutionFailedException(String message, int exitCode, List<String> outputTail) {
        super(message);
        this.exitCode = exitCode;
        this.outputTail = outputTail == null ? List.of() : List.copyOf(outputTail);
    }

    public ExecutionFailedException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = -1;
        this.outputTail = List.of();
    }
}
