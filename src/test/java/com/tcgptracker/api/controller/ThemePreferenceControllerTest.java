package com.tcgptracker.api.controller;

import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Integration tests for the theme preference API.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class ThemePreferenceControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void testGet_DefaultsToAuto() throws Exception {
        mockMvc.perform(get("/api/theme"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.preference").value("auto"))
            .andExpect(jsonPath("$.theme").value("light"))
            .andExpect(jsonPath("$.source").value("system"));
    }

    @Test
    void testGet_AutoFollowsColorSchemeHint() throws Exception {
        mockMvc.perform(get("/api/theme").header("Sec-CH-Prefers-Color-Scheme", "\"dark\""))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.preference").value("auto"))
            .andExpect(jsonPath("$.theme").value("dark"));
    }

    @Test
    void testGet_ExplicitLightIgnoresColorSchemeHint() throws Exception {
        mockMvc.perform(get("/api/theme")
                .cookie(new Cookie("preferred_theme", "light"))
                .header("Sec-CH-Prefers-Color-Scheme", "\"dark\""))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.preference").value("light"))
            .andExpect(jsonPath("$.theme").value("light"));
    }

    @Test
    void testGet_StoredPreference() throws Exception {
        mockMvc.perform(get("/api/theme").cookie(new Cookie("preferred_theme", "dark")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.preference").value("dark"))
            .andExpect(jsonPath("$.theme").value("dark"))
            .andExpect(jsonPath("$.source").value("user"));
    }

    @Test
    void testUpdate_StoresCookie() throws Exception {
        mockMvc.perform(post("/api/theme")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"theme\":\"dark\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.preference").value("dark"))
            .andExpect(cookie().value("preferred_theme", "dark"))
            .andExpect(cookie().path("preferred_theme", "/"));
    }

    @Test
    void testUpdate_UnknownTheme() throws Exception {
        mockMvc.perform(post("/api/theme")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"theme\":\"sepia\"}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void testUpdate_MissingTheme() throws Exception {
        mockMvc.perform(post("/api/theme")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void testToggle_CyclesLightDarkAuto() throws Exception {
        mockMvc.perform(post("/api/theme/toggle").cookie(new Cookie("preferred_theme", "light")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.preference").value("dark"))
            .andExpect(cookie().value("preferred_theme", "dark"));

        mockMvc.perform(post("/api/theme/toggle").cookie(new Cookie("preferred_theme", "dark")))
            .andExpect(jsonPath("$.preference").value("auto"))
            .andExpect(cookie().value("preferred_theme", "auto"));

        mockMvc.perform(post("/api/theme/toggle").cookie(new Cookie("preferred_theme", "auto")))
            .andExpect(jsonPath("$.preference").value("light"));
    }
}
