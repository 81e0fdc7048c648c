package com.tcgptracker.seed;

import lombok.Value;

/**
 * Number of rows created by one seed import.
 */
@Value
public class SeedReport {
    int rarities;
    int generations;
    int packTypes;
    int probabilities;
    int sets;
    int packs;
    int cards;

    public int getTotal() {
        return rarities + generations + packTypes + probabilities + sets + packs + cards;
    }
}
