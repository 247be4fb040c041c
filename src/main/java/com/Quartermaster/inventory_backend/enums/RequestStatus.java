package com.Quartermaster.inventory_backend.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RequestStatus {
    PENDING("pending"),
    APPROVED("approved"),
    DENIED("denied");

    private final String value;

    RequestStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this != PENDING;
    }

    public static RequestStatus fromString(String text) {
        if (text != null) {
            for (RequestStatus status : RequestStatus.values()) {
                if (status.value.equalsIgnoreCase(text.trim())) {
                    return status;
                }
            }
        }
        throw new IllegalArgumentException("Unknown request status: " + text);
    }
}
