package com.tcgptracker.collection;

import com.tcgptracker.catalog.PokemonSet;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Collection progress for one set.
 */
@Value
public class SetProgress {
    PokemonSet set;
    long collected;
    long total;
    List<RarityGroupProgress> rarityProgress;

    /**
     * Percentage of collected cards rounded to 2 decimals; 0 for an empty set.
     */
    public double getProgressPercent() {
        return percent(collected, total);
    }

    public static double percent(long part, long whole) {
        if (whole <= 0) {
            return 0.0;
        }
        return BigDecimal.valueOf(part * 100.0 / whole)
            .setScale(2, RoundingMode.HALF_UP)
            .doubleValue();
    }
}
