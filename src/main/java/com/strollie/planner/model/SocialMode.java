package com.strollie.planner.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SocialMode {
    SOLO,
    FRIENDS,
    COUPLE,
    FAMILY;

    @JsonCreator
    public static SocialMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            return SOLO;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return SOLO;
        }
    }

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
