package com.machina.provisioning.entity;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CredentialStatus {

    VALID("valid"),
    INVALID("invalid"),
    EXPIRED("expired"),
    UNCHECKED("unchecked");

    private final String value;

    CredentialStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
