package com.machina.provisioning.exception;

/**
 * Referenced machine, deployment or provider account does not exist.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String resource, Object id) {
        super(resource + " not found: " + id);
    }
}
