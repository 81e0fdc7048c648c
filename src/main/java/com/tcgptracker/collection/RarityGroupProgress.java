package com.tcgptracker.collection;

import lombok.Value;

/**
 * Collected and total card counts of one rarity group within a set.
 */
@Value
public class RarityGroupProgress {
    String key;
    String imageName;
    String label;
    int repeatCount;
    long collected;
    long total;

    public boolean isComplete() {
        return total > 0 && collected >= total;
    }
}
