package com.Quartermaster.inventory_backend.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum HistoryAction {
    CHECKOUT("checkout"),
    CHECKIN("checkin");

    private final String value;

    HistoryAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static HistoryAction fromString(String text) {
        if (text != null) {
            for (HistoryAction action : HistoryAction.values()) {
                if (action.value.equalsIgnoreCase(text.trim())) {
                    return action;
                }
            }
        }
        throw new IllegalArgumentException("Unknown history action: " + text);
    }
}
