package com.machina.provisioning.entity;

import com.fasterxml.jackson.annotation.JsonValue;

public enum LogLevel {

    DEBUG("debug"),
    INFO("info"),
    WARN("warn"),
    ERROR("error");

    private final String value;

    LogLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
