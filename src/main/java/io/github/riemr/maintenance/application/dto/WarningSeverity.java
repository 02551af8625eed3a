package io.github.riemr.maintenance.application.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum WarningSeverity {
    INFO("info"),
    WARNING("warning");

    private final String value;

    WarningSeverity(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
