package com.tcgptracker.seed;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON shape of the catalog seed file.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class SeedDocument {

    private List<RaritySeed> rarities = new ArrayList<>();
    private List<GenerationSeed> generations = new ArrayList<>();
    private List<SetSeed> sets = new ArrayList<>();

    @Data
    public static class RaritySeed {
        private String name;
        private String displayName;
        private int sortOrder;
        private String imageName;
        private int repeatCount = 1;
    }

    @Data
    public static class GenerationSeed {
        private String name;
        private String displayName;
        private String description;
        private List<PackTypeSeed> packTypes = new ArrayList<>();
    }

    @Data
    public static class PackTypeSeed {
        private String name;
        private String displayName;
        private int slotCount = 5;
        private double occurrenceProbability;
        private String description;
        private List<ProbabilitySeed> probabilities = new ArrayList<>();
    }

    @Data
    public static class ProbabilitySeed {
        private String rarity;
        private List<Double> slots = new ArrayList<>();
    }

    @Data
    public static class SetSeed {
        private String number;
        private String name;
        private LocalDate releaseDate;
        private LocalDate availableUntil;
        private String generation;
        private List<PackSeed> packs = new ArrayList<>();
        private List<CardSeed> cards = new ArrayList<>();
    }

    @Data
    public static class PackSeed {
        private String name;

        /**
         * Rarity generation of the pack; the set's generation when absent.
         */
        private String generation;
    }

    @Data
    public static class CardSeed {
        private String number;
        private String name;
        private String rarity;
        private List<String> packs = new ArrayList<>();
    }
}
