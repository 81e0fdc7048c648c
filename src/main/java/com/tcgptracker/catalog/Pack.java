package com.tcgptracker.catalog;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A booster pack of a set. Its rarity generation decides which probabilities apply.
 */
@Entity
@Table(name = "packs", uniqueConstraints = {
    @UniqueConstraint(name = "uk_pack_set_name", columnNames = {"set_id", "name"})
})
@Getter
@Setter
@NoArgsConstructor
public class Pack {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "set_id")
    private PokemonSet pokemonSet;

    @Column(length = 100, nullable = false)
    private String name;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "rarity_generation_name")
    private Generation rarityGeneration;

    @ManyToMany(mappedBy = "packs")
    private Set<Card> cards = new LinkedHashSet<>();

    public Pack(PokemonSet pokemonSet, String name, Generation rarityGeneration) {
        this.pokemonSet = pokemonSet;
        this.name = name;
        this.rarityGeneration = rarityGeneration;
    }
}
