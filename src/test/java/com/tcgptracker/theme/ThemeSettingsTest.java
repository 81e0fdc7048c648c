package com.tcgptracker.theme;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for theme resolution and the toggle ring.
 */
class ThemeSettingsTest {

    @Test
    void testAutoFollowsSystem() {
        assertEquals(AppliedTheme.DARK, ThemeSettings.of(ThemePreference.AUTO, true).getAppliedTheme());
        assertEquals(AppliedTheme.LIGHT, ThemeSettings.of(ThemePreference.AUTO, false).getAppliedTheme());
    }

    @Test
    void testExplicitPreferenceIgnoresSystem() {
        assertEquals(AppliedTheme.LIGHT, ThemeSettings.of(ThemePreference.LIGHT, true).getAppliedTheme());
        assertEquals(AppliedTheme.DARK, ThemeSettings.of(ThemePreference.DARK, false).getAppliedTheme());
    }

    @Test
    void testDefaultIsAuto() {
        assertEquals(ThemePreference.AUTO, ThemeSettings.of(null, false).getPreference());
    }

    @Test
    void testToggleRing() {
        ThemeSettings light = ThemeSettings.of(ThemePreference.LIGHT, false);

        assertEquals(ThemePreference.DARK, light.toggle().getPreference());
        assertEquals(ThemePreference.AUTO, light.toggle().toggle().getPreference());
    }

    @ParameterizedTest
    @EnumSource(ThemePreference.class)
    void testThreeTogglesReturnToStart(ThemePreference start) {
        ThemeSettings settings = ThemeSettings.of(start, true);

        assertEquals(settings, settings.toggle().toggle().toggle());
    }

    @Test
    void testToggleTitle() {
        assertEquals("Auto mode (click for light)", ThemeSettings.of(ThemePreference.AUTO, false).getToggleTitle());
    }

    @Test
    void testFromValue() {
        assertEquals(ThemePreference.DARK, ThemePreference.fromValue(" Dark ").orElseThrow());
        assertTrue(ThemePreference.fromValue("sepia").isEmpty());
        assertTrue(ThemePreference.fromValue(null).isEmpty());
    }
}
