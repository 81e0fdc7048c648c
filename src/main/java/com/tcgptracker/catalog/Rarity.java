package com.tcgptracker.catalog;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Rarity classification of a card.
 *
 * The name is the internal key (e.g. {@code illustration_rare}); the sort order drives
 * both table sorting and the grouping of rarity progress.
 */
@Entity
@Table(name = "rarities", indexes = {
    @Index(name = "idx_rarity_sort_order", columnList = "sort_order")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Rarity {

    @Id
    @Column(length = 20)
    private String name;

    @Column(name = "display_name", length = 4, unique = true, nullable = false)
    private String displayName;

    @Column(name = "sort_order", unique = true, nullable = false)
    private int sortOrder;

    /**
     * Optional image filename for the rarity symbol.
     * Rarities sharing an image name are grouped together in progress views.
     */
    @Column(name = "image_name", length = 100)
    private String imageName;

    /**
     * How many times the rarity symbol repeats when rendered.
     */
    @Column(name = "repeat_count", nullable = false)
    private int repeatCount = 1;
}
