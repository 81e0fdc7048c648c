package com.tcgptracker.packs;

import com.tcgptracker.catalog.Pack;
import lombok.Value;

/**
 * One line of the pack list.
 */
@Value
public class PackSummary {
    Pack pack;

    /**
     * Expected chance of at least one new card, in percent with 2 decimals.
     */
    double chance;
    int total;
    int owned;
    double progressPercent;

    /**
     * Some base-rarity card of this pack is still missing.
     */
    boolean incompleteBase;
    boolean best;
}
