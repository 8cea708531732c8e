package com.machina.provisioning.terraform;

/**
 * The running external process was terminated because its deployment was cancelled.
 */
public class ExecutionCancelledException extends RuntimeException {

    public ExecutionCancelledException(String message) {
        super(message);
    }
}
