package com.tcgptracker.theme;

import java.util.Optional;

/**
 * The theme a user asked for. {@code AUTO} follows the system colour scheme.
 */
public enum ThemePreference {
    LIGHT("light"),
    DARK("dark"),
    AUTO("auto");

    public static final ThemePreference DEFAULT = AUTO;

    private final String value;

    ThemePreference(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Next preference of the toggle ring light, dark, auto.
     */
    public ThemePreference next() {
        return switch (this) {
            case LIGHT -> DARK;
            case DARK -> AUTO;
            case AUTO -> LIGHT;
        };
    }

    public static Optional<ThemePreference> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (ThemePreference preference : values()) {
            if (preference.value.equalsIgnoreCase(value.trim())) {
                return Optional.of(preference);
            }
        }
        return Optional.empty();
    }
}
