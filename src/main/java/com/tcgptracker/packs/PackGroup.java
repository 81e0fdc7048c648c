package com.tcgptracker.packs;

import com.tcgptracker.catalog.PokemonSet;
import lombok.Value;

import java.util.List;

/**
 * Packs of one set, in pack list order.
 */
@Value
public class PackGroup {
    PokemonSet set;
    List<PackSummary> packs;
}
