package com.tcgptracker.catalog;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;

/**
 * A set of cards, e.g. "Genetic Apex" (A1).
 */
@Entity
@Table(name = "pokemon_sets", indexes = {
    @Index(name = "idx_set_number", columnList = "number"),
    @Index(name = "idx_set_release_date", columnList = "release_date"),
    @Index(name = "idx_set_generation", columnList = "generation_name")
})
@Getter
@Setter
@NoArgsConstructor
public class PokemonSet {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = 10, nullable = false)
    private String number;

    @Column(length = 100, nullable = false)
    private String name;

    @Column(name = "release_date", nullable = false)
    private LocalDate releaseDate;

    /**
     * Date when the set's packs stop being available. Empty while still available.
     */
    @Column(name = "available_until")
    private LocalDate availableUntil;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "generation_name")
    private Generation generation;

    public PokemonSet(String number, String name, LocalDate releaseDate) {
        this.number = number;
        this.name = name;
        this.releaseDate = releaseDate;
    }

    public boolean isAvailable(LocalDate today) {
        return availableUntil == null || !today.isAfter(availableUntil);
    }

    public boolean isAvailable() {
        return isAvailable(LocalDate.now());
    }
}
