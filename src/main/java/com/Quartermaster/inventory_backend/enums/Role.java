package com.Quartermaster.inventory_backend.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Role {
    MEMBER("member"),
    ADMIN("admin"),
    QUARTERMASTER("quartermaster");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String authority() {
        return "ROLE_" + name();
    }

    public static Role fromString(String text) {
        if (text != null) {
            for (Role role : Role.values()) {
                if (role.value.equalsIgnoreCase(text.trim())) {
                    return role;
                }
            }
        }
        throw new IllegalArgumentException("Unknown role: " + text);
    }
}
