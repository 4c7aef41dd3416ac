package org.dxworks.fortframe.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum Permission {
    PUBLIC("public"),
    PRIVATE("private"),
    PROTECTED("protected");

    private final String keyword;

    Permission(String keyword) {
        this.keyword = keyword;
    }

    @JsonValue
    public String getKeyword() {
        return keyword;
    }

    public static Optional<Permission> fromKeyword(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT);
        for (Permission permission : values()) {
            if (permission.keyword.equals(normalized)) {
                return Optional.of(permission);
            }
        }
        return Optional.empty();
    }

    public boolean isExported() {
        return this != PRIVATE;
    }
}
