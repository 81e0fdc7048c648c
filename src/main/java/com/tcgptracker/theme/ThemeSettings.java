package com.tcgptracker.theme;

import lombok.Value;

/**
 * A user's theme preference together with the system colour scheme it is resolved against.
 *
 * One instance is built per request and handed to whatever renders or changes the theme.
 * Instances are immutable; every change returns a new one.
 */
@Value
public class ThemeSettings {
    ThemePreference preference;
    boolean systemPrefersDark;

    public static ThemeSettings of(ThemePreference preference, boolean systemPrefersDark) {
        return new ThemeSettings(preference == null ? ThemePreference.DEFAULT : preference, systemPrefersDark);
    }

    /**
     * Explicit preferences win; {@code auto} follows the system.
     */
    public AppliedTheme getAppliedTheme() {
        return switch (preference) {
            case LIGHT -> AppliedTheme.LIGHT;
            case DARK -> AppliedTheme.DARK;
            case AUTO -> systemPrefersDark ? AppliedTheme.DARK : AppliedTheme.LIGHT;
        };
    }

    public ThemeSettings toggle() {
        return new ThemeSettings(preference.next(), systemPrefersDark);
    }

    public ThemeSettings withPreference(ThemePreference newPreference) {
        return new ThemeSettings(newPreference, systemPrefersDark);
    }

    /**
     * Tooltip of the toggle button, naming the current mode and the one a click selects.
     */
    public String getToggleTitle() {
        return switch (preference) {
            case LIGHT -> "Light mode (click for dark)";
            case DARK -> "Dark mode (click for auto)";
            case AUTO -> "Auto mode (click for light)";
        };
    }
}
