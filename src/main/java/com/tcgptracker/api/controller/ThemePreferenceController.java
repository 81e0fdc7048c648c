package com.tcgptracker.api.controller;

import com.tcgptracker.api.dto.ThemeResponse;
import com.tcgptracker.api.dto.ThemeUpdateRequest;
import com.tcgptracker.theme.ThemePreference;
import com.tcgptracker.theme.ThemeService;
import com.tcgptracker.theme.ThemeSettings;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for the light/dark/auto theme preference.
 *
 * The preference is kept in a cookie so that pages render with the right
 * {@code data-theme} before any script runs.
 */
@RestController
@RequestMapping("/api/theme")
@RequiredArgsConstructor
@Tag(name = "Theme", description = "Theme preference API")
public class ThemePreferenceController {

    private final ThemeService themeService;

    @GetMapping
    @Operation(summary = "Get the current theme preference and the applied theme")
    public ResponseEntity<ThemeResponse> getThemePreference(HttpServletRequest request) {
        ThemeSettings settings = themeService.resolve(request);
        return ResponseEntity.ok(ThemeResponse.of(settings, themeService.hasStoredPreference(request)));
    }

    @PostMapping
    @Operation(summary = "Set the theme preference (light, dark or auto)")
    public ResponseEntity<ThemeResponse> updateThemePreference(@Valid @RequestBody ThemeUpdateRequest body,
                                                               HttpServletRequest request,
                                                               HttpServletResponse response) {
        ThemePreference preference = ThemePreference.fromValue(body.getTheme())
            .orElseThrow(() -> new IllegalArgumentException("Unknown theme: " + body.getTheme()));
        ThemeSettings settings = themeService.resolve(request).withPreference(preference);
        themeService.store(preference, response);
        return ResponseEntity.ok(ThemeResponse.of(settings, true));
    }

    @PostMapping("/toggle")
    @Operation(summary = "Advance the theme preference: light, dark, auto, light")
    public ResponseEntity<ThemeResponse> toggleThemePreference(HttpServletRequest request,
                                                               HttpServletResponse response) {
        ThemeSettings settings = themeService.resolve(request).toggle();
        themeService.store(settings.getPreference(), response);
        return ResponseEntity.ok(ThemeResponse.of(settings, true));
    }
}
