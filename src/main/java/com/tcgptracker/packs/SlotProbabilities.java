package com.tcgptracker.packs;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-rarity draw probabilities for the active slots of one pack type.
 */
public final class SlotProbabilities {

    private final int slotCount;
    private final Map<String, double[]> byRarity;

    private SlotProbabilities(int slotCount, Map<String, double[]> byRarity) {
        this.slotCount = slotCount;
        this.byRarity = byRarity;
    }

    public static Builder builder(int slotCount) {
        return new Builder(slotCount);
    }

    public int getSlotCount() {
        return slotCount;
    }

    public Map<String, double[]> asMap() {
        return Collections.unmodifiableMap(byRarity);
    }

    public boolean isEmpty() {
        return byRarity.isEmpty();
    }

    /**
     * @param slot 1-based slot index
     */
    public double get(String rarityName, int slot) {
        double[] slots = byRarity.get(rarityName);
        if (slots == null || slot < 1 || slot > slots.length) {
            return 0.0;
        }
        return slots[slot - 1];
    }

    public static final class Builder {

        private final int slotCount;
        private final Map<String, double[]> byRarity = new LinkedHashMap<>();

        private Builder(int slotCount) {
            this.slotCount = slotCount;
        }

        public Builder rarity(String rarityName, double... slots) {
            byRarity.put(rarityName, slots.clone());
            return this;
        }

        public SlotProbabilities build() {
            return new SlotProbabilities(slotCount, byRarity);
        }
    }
}
