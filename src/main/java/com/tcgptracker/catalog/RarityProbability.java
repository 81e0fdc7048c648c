package com.tcgptracker.catalog;

import com.tcgptracker.common.exception.InvalidProbabilityException;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

/**
 * Probability of drawing a rarity in each slot of a pack type.
 *
 * Six slots are stored; only the first {@link PackType#getSlotCount()} are active.
 * Slot 6 exists for special pack types with an extra card.
 */
@Entity
@Table(name = "rarity_probabilities", uniqueConstraints = {
    @UniqueConstraint(name = "uk_probability_generation_pack_type_rarity",
        columnNames = {"generation_name", "pack_type_id", "rarity_name"})
})
@Getter
@Setter
@NoArgsConstructor
public class RarityProbability {

    public static final int MAX_SLOTS = 6;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "rarity_name")
    private Rarity rarity;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "generation_name")
    private Generation generation;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "pack_type_id")
    private PackType packType;

    @Column(name = "probability_slot1", nullable = false)
    private double slot1;

    @Column(name = "probability_slot2", nullable = false)
    private double slot2;

    @Column(name = "probability_slot3", nullable = false)
    private double slot3;

    @Column(name = "probability_slot4", nullable = false)
    private double slot4;

    @Column(name = "probability_slot5", nullable = false)
    private double slot5;

    @Column(name = "probability_slot6", nullable = false)
    private double slot6;

    public RarityProbability(Rarity rarity, Generation generation, PackType packType) {
        this.rarity = rarity;
        this.generation = generation;
        this.packType = packType;
    }

    public List<Double> getSlotProbabilities() {
        return List.of(slot1, slot2, slot3, slot4, slot5, slot6);
    }

    /**
     * @param slot 1-based slot index
     */
    public double getSlotProbability(int slot) {
        return switch (slot) {
            case 1 -> slot1;
            case 2 -> slot2;
            case 3 -> slot3;
            case 4 -> slot4;
            case 5 -> slot5;
            case 6 -> slot6;
            default -> throw new IllegalArgumentException("Slot out of range: " + slot);
        };
    }

    /**
     * Replace all slot probabilities. Missing trailing values are set to zero.
     */
    public void setSlotProbabilities(List<Double> values) {
        if (values.size() > MAX_SLOTS) {
            throw new IllegalArgumentException("At most " + MAX_SLOTS + " slots, got " + values.size());
        }
        double[] slots = new double[MAX_SLOTS];
        for (int i = 0; i < values.size(); i++) {
            Double value = values.get(i);
            double probability = value == null ? 0.0 : value;
            if (probability < 0.0 || probability > 1.0) {
                throw new InvalidProbabilityException(i + 1, probability);
            }
            slots[i] = probability;
        }
        this.slot1 = slots[0];
        this.slot2 = slots[1];
        this.slot3 = slots[2];
        this.slot4 = slots[3];
        this.slot5 = slots[4];
        this.slot6 = slots[5];
    }
}
