package com.tcgptracker.web.controller;

import com.tcgptracker.CatalogFixtures;
import com.tcgptracker.catalog.Card;
import com.tcgptracker.catalog.Generation;
import com.tcgptracker.catalog.PokemonSet;
import com.tcgptracker.collection.CollectionService;
import com.tcgptracker.users.AppUser;
import com.tcgptracker.users.UserAccountService;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.csrf;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Integration tests for the set-detail page and its collection requests.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Transactional
@WithMockUser(username = "ash")
class SetDetailControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private CollectionService collectionService;

    @Autowired
    private UserAccountService userAccountService;

    @Autowired
    private CatalogFixtures fixtures;

    private AppUser user;
    private PokemonSet set;
    private Card bulbasaur;
    private Card ivysaur;

    @BeforeEach
    void setUp() {
        fixtures.rarities();
        Generation generation = fixtures.generation();
        set = fixtures.set("A1", "Genetic Apex", LocalDate.of(2024, 10, 30), generation);
        bulbasaur = fixtures.card(set, "001", "Bulbasaur", "common");
        ivysaur = fixtures.card(set, "002", "Ivysaur", "uncommon");
        fixtures.card(set, "227", "Pikachu", "illustration_rare");

        user = userAccountService.register("ash", "ash@example.com", "pikachu-123");
        collectionService.collect(user, bulbasaur);
    }

    @Test
    void testSetDetailPage() throws Exception {
        mockMvc.perform(get("/set/A1"))
            .andExpect(status().isOk())
            .andExpect(view().name("tracker/set_detail"))
            .andExpect(model().attribute("baseCardsMissing", 1))
            .andExpect(model().attribute("hasJumpTarget", true))
            .andExpect(content().string(containsString("id=\"card-table\"")))
            .andExpect(content().string(containsString("Bulbasaur")))
            .andExpect(content().string(containsString("id=\"collect-base-btn\"")))
            .andExpect(content().string(containsString("data-threshold=\"200\"")));
    }

    @Test
    void testSetDetailPage_ThemeAttributes() throws Exception {
        mockMvc.perform(get("/set/A1")
                .cookie(new Cookie("preferred_theme", "light"))
                .header("Sec-CH-Prefers-Color-Scheme", "\"dark\""))
            .andExpect(status().isOk())
            .andExpect(content().string(containsString("data-theme=\"light\"")))
            .andExpect(content().string(containsString("data-theme-preference=\"light\"")));

        mockMvc.perform(get("/set/A1").header("Sec-CH-Prefers-Color-Scheme", "\"dark\""))
            .andExpect(content().string(containsString("data-theme=\"dark\"")))
            .andExpect(content().string(containsString("data-theme-preference=\"auto\"")));
    }

    @Test
    void testSetDetailPage_Filtered() throws Exception {
        mockMvc.perform(get("/set/A1").param("filter", "ivy"))
            .andExpect(status().isOk())
            .andExpect(content().string(containsString("Ivysaur")))
            .andExpect(content().string(not(containsString("Bulbasaur"))));
    }

    @Test
    void testSetDetailPage_UnknownSet() throws Exception {
        mockMvc.perform(get("/set/ZZ"))
            .andExpect(status().isNotFound());
    }

    @Test
    void testRarityProgressFragment() throws Exception {
        mockMvc.perform(get("/set/A1").param("fragment", "rarity_progress"))
            .andExpect(status().isOk())
            .andExpect(content().string(containsString("id=\"rarity-progress\"")))
            .andExpect(content().string(not(containsString("id=\"card-table\""))));
    }

    @Test
    void testAjaxCollect() throws Exception {
        mockMvc.perform(post("/set/A1")
                .with(csrf())
                .header("X-Requested-With", "XMLHttpRequest")
                .param("card_id", ivysaur.getId().toString())
                .param("action", "collect"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("success"))
            .andExpect(jsonPath("$.collected").value(true));

        assertTrue(collectionService.isCollected(user, ivysaur));
    }

    @Test
    void testAjaxUncollect() throws Exception {
        mockMvc.perform(post("/set/A1")
                .with(csrf())
                .header("X-Requested-With", "XMLHttpRequest")
                .param("card_id", bulbasaur.getId().toString())
                .param("action", "uncollect"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.collected").value(false));

        assertFalse(collectionService.isCollected(user, bulbasaur));
    }

    @Test
    void testFormPost_RedirectsBack() throws Exception {
        mockMvc.perform(post("/set/A1")
                .with(csrf())
                .param("card_id", ivysaur.getId().toString())
                .param("action", "collect"))
            .andExpect(status().is3xxRedirection())
            .andExpect(redirectedUrl("/set/A1"));

        assertTrue(collectionService.isCollected(user, ivysaur));
    }

    @Test
    void testFormPost_CollectBaseCards() throws Exception {
        mockMvc.perform(post("/set/A1")
                .with(csrf())
                .param("bulk", "base"))
            .andExpect(status().is3xxRedirection())
            .andExpect(flash().attribute("message", "Collected 1 base cards."));

        assertTrue(collectionService.isCollected(user, ivysaur));
    }

    @Test
    void testAjax_UnknownAction() throws Exception {
        mockMvc.perform(post("/set/A1")
                .with(csrf())
                .header("X-Requested-With", "XMLHttpRequest")
                .param("card_id", ivysaur.getId().toString())
                .param("action", "trade"))
            .andExpect(status().isBadRequest())
            .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
            .andExpect(jsonPath("$.status").value("400"))
            .andExpect(jsonPath("$.error").exists());

        assertFalse(collectionService.isCollected(user, ivysaur));
    }

    @Test
    void testAjax_UnknownCard() throws Exception {
        mockMvc.perform(post("/set/A1")
                .with(csrf())
                .header("X-Requested-With", "XMLHttpRequest")
                .param("card_id", "-1")
                .param("action", "collect"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.status").value("404"));
    }

    @Test
    void testAjaxCollect_Twice() throws Exception {
        for (int i = 0; i < 2; i++) {
            mockMvc.perform(post("/set/A1")
                    .with(csrf())
                    .header("X-Requested-With", "XMLHttpRequest")
                    .param("card_id", ivysaur.getId().toString())
                    .param("action", "collect"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.collected").value(true));
        }

        assertTrue(collectionService.isCollected(user, ivysaur));
    }

    @Test
    void testTrailingSlashPaths() throws Exception {
        mockMvc.perform(get("/set/A1/"))
            .andExpect(status().isOk())
            .andExpect(view().name("tracker/set_detail"));

        mockMvc.perform(post("/set/A1/")
                .with(csrf())
                .header("X-Requested-With", "XMLHttpRequest")
                .param("card_id", ivysaur.getId().toString())
                .param("action", "collect"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.collected").value(true));
    }

    @Test
    void testPost_WithoutCsrfToken() throws Exception {
        mockMvc.perform(post("/set/A1")
                .param("card_id", ivysaur.getId().toString())
                .param("action", "collect"))
            .andExpect(status().isForbidden());
    }
}
