package com.Quartermaster.inventory_backend.util;

public final class TextUtils {

    private TextUtils() {
    }

    public static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static String orEmpty(String value) {
        return value != null ? value : "";
    }
}
