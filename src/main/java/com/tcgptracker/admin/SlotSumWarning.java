package com.tcgptracker.admin;

import lombok.Value;

import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Active slots of a pack type whose probabilities do not sum to 1.
 */
@Value
public class SlotSumWarning {
    String generationName;
    String packTypeName;

    /**
     * Sum per drifting slot, keyed by 1-based slot index, in slot order.
     */
    Map<Integer, Double> drift;

    public String getMessage() {
        String slots = drift.entrySet().stream()
            .map(e -> String.format(Locale.ROOT, "probability_slot%d=%.6f", e.getKey(), e.getValue()))
            .collect(Collectors.joining(", "));
        return "Rarity probability sums for " + generationName + " - " + packTypeName
            + " are off (expected 1.0): " + slots;
    }
}
