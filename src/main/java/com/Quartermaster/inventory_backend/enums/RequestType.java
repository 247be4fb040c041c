package com.Quartermaster.inventory_backend.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RequestType {
    ADD_ITEM("add_item"),
    REMOVE_ITEM("remove_item");

    private final String value;

    RequestType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static RequestType fromString(String text) {
        if (text != null) {
            for (RequestType type : RequestType.values()) {
                if (type.value.equalsIgnoreCase(text.trim())) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown request type: " + text);
    }
}
