package com.tcgptracker.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Application settings under the {@code tracker} prefix.
 */
@ConfigurationProperties(prefix = "tracker")
@Data
public class TrackerProperties {

    /**
     * Short git revision of the running build, exported as GIT_HASH by the container entrypoint.
     */
    private String gitHash = "unknown";

    private Ui ui = new Ui();

    private Theme theme = new Theme();

    private Seed seed = new Seed();

    @Data
    public static class Ui {

        /**
         * Scroll offset in pixels above which the floating buttons are shown.
         */
        private int floatingButtonsThreshold = 200;

        /**
         * Rarities collected by the "collect base cards" button.
         */
        private List<String> baseRarities = new ArrayList<>(List.of("common", "uncommon", "rare", "double_rare"));

        /**
         * Rarity the jump button scrolls to.
         */
        private String jumpRarity = "illustration_rare";

        private int highlightMillis = 2000;
    }

    @Data
    public static class Theme {

        private String cookieName = "preferred_theme";

        private int cookieMaxAgeSeconds = 365 * 24 * 60 * 60;
    }

    @Data
    public static class Seed {

        /**
         * Import the catalog seed document at startup.
         */
        private boolean enabled = false;

        private String location = "classpath:seed/catalog.json";
    }
}
