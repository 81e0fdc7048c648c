package com.tcgptracker.api.dto;

import com.tcgptracker.theme.ThemeSettings;
import lombok.Value;

/**
 * Theme preference as stored and as applied.
 */
@Value
public class ThemeResponse {
    String preference;
    String theme;
    String source;

    public static ThemeResponse of(ThemeSettings settings, boolean stored) {
        return new ThemeResponse(
            settings.getPreference().getValue(),
            settings.getAppliedTheme().getAttribute(),
            stored ? "user" : "system"
        );
    }
}
