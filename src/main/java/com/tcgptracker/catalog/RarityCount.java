package com.tcgptracker.catalog;

/**
 * Projection of a card count per set and rarity.
 */
public interface RarityCount {

    Long getSetId();

    String getRarityName();

    long getTotal();
}
