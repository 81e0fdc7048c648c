package com.tcgptracker.catalog;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A single card of a set.
 *
 * The number is the card's printed index within its set and is kept as text
 * ("001", "P-12"); numeric ordering is applied when rendering tables.
 */
@Entity
@Table(name = "cards", uniqueConstraints = {
    @UniqueConstraint(name = "uk_card_set_number", columnNames = {"set_id", "number"})
}, indexes = {
    @Index(name = "idx_card_name", columnList = "name")
})
@Getter
@Setter
@NoArgsConstructor
public class Card {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "set_id")
    private PokemonSet pokemonSet;

    @Column(length = 10, nullable = false)
    private String number;

    @Column(length = 100, nullable = false)
    private String name;

    @ManyToOne(optional = false)
    @JoinColumn(name = "rarity_name")
    private Rarity rarity;

    @ManyToMany
    @JoinTable(name = "card_packs",
        joinColumns = @JoinColumn(name = "card_id"),
        inverseJoinColumns = @JoinColumn(name = "pack_id"))
    private Set<Pack> packs = new LinkedHashSet<>();

    public Card(PokemonSet pokemonSet, String number, String name, Rarity rarity) {
        this.pokemonSet = pokemonSet;
        this.number = number;
        this.name = name;
        this.rarity = rarity;
    }

    public void addPack(Pack pack) {
        packs.add(pack);
        pack.getCards().add(this);
    }
}
