package com.tcgptracker.catalog;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A generation of rarity distribution and pack types, e.g. G1.
 */
@Entity
@Table(name = "generations")
@Data
@NoArgsConstructor
public class Generation {

    private static final Set<String> GOD_PACK_BASE_RARITIES = Set.of(
        "illustration_rare",
        "special_art",
        "immersive_rare",
        "crown_rare"
    );

    private static final Set<String> GOD_PACK_SHINY_RARITIES = Set.of(
        "shiny_rare",
        "double_shiny_rare"
    );

    private static final Set<String> SHINY_GOD_PACK_GENERATIONS = Set.of("G2", "G3");

    @Id
    @Column(length = 3)
    private String name;

    @Column(name = "display_name", length = 20, unique = true, nullable = false)
    private String displayName;

    @Column(columnDefinition = "text")
    private String description;

    @OneToMany(mappedBy = "generation")
    @OrderBy("occurrenceProbability DESC")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private List<PackType> packTypes = new ArrayList<>();

    public Generation(String name, String displayName) {
        this.name = name;
        this.displayName = displayName;
    }

    /**
     * Rarity names that can appear in a god pack of this generation.
     * Generations G2 and G3 also put shinies into god packs.
     */
    public Set<String> getGodPackEligibleRarityNames() {
        if (!SHINY_GOD_PACK_GENERATIONS.contains(name)) {
            return GOD_PACK_BASE_RARITIES;
        }
        Set<String> names = new HashSet<>(GOD_PACK_BASE_RARITIES);
        names.addAll(GOD_PACK_SHINY_RARITIES);
        return names;
    }
}
