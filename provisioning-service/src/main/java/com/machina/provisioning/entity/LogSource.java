package com.machina.provisioning.entity;

import com.fasterxml.jackson.annotation.JsonValue;

public enum LogSource {

    TERRAFORM("terraform"),
    SYSTEM("system"),
    PROVIDER("provider");

    private final String value;

    LogSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
