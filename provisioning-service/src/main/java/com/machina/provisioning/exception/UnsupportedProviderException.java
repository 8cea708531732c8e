package com.machina.provisioning.exception;

import com.machina.provisioning.entity.ProviderType;

public class UnsupportedProviderException extends RuntimeException {

    public UnsupportedProviderException(ProviderType providerType, String operation) {
        super(providerType.getDisplayName() + " does not support " + operation + " yet");
    }
}
