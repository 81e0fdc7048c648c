package com.tcgptracker.catalog;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A kind of booster pack within a generation (normal, shiny, god, ...).
 */
@Entity
@Table(name = "pack_types", uniqueConstraints = {
    @UniqueConstraint(name = "uk_pack_type_generation_name", columnNames = {"generation_name", "name"})
})
@Getter
@Setter
@NoArgsConstructor
public class PackType {

    public static final int DEFAULT_SLOT_COUNT = 5;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "generation_name")
    private Generation generation;

    @Column(length = 20, nullable = false)
    private String name;

    @Column(name = "display_name", length = 30, nullable = false)
    private String displayName;

    @Column(name = "slot_count", nullable = false)
    private int slotCount = DEFAULT_SLOT_COUNT;

    /**
     * Probability of getting this pack type, as a decimal (0.05238 for 5.238%).
     */
    @Column(name = "occurrence_probability", nullable = false)
    private double occurrenceProbability;

    @Column(columnDefinition = "text")
    private String description;

    public PackType(Generation generation, String name, String displayName,
                    int slotCount, double occurrenceProbability) {
        this.generation = generation;
        this.name = name;
        this.displayName = displayName;
        this.slotCount = slotCount;
        this.occurrenceProbability = occurrenceProbability;
    }

    /**
     * God packs have their probabilities derived from card counts instead of stored rows.
     */
    public boolean isGodPack() {
        return name != null && name.toLowerCase().contains("god");
    }
}
