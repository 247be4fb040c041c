package com.Quartermaster.inventory_backend.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ReviewDecision {
    APPROVED("approved"),
    DENIED("denied");

    private final String value;

    ReviewDecision(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public RequestStatus toStatus() {
        return switch (this) {
            case APPROVED -> RequestStatus.APPROVED;
            case DENIED -> RequestStatus.DENIED;
        };
    }
}
