package com.tcgptracker.collection;

import com.tcgptracker.catalog.Card;
import com.tcgptracker.users.AppUser;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Collection-status record: the user owns the card.
 *
 * A card is collected exactly when a row exists for (user, card). Rows are inserted by
 * {@link UserCardRepository#insertIfAbsent}.
 */
@Entity
@Table(name = "user_cards", uniqueConstraints = {
    @UniqueConstraint(name = "uk_user_card", columnNames = {"user_id", "card_id"})
})
@Getter
@Setter
@NoArgsConstructor
public class UserCard {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id")
    private AppUser user;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "card_id")
    private Card card;

    @Column(nullable = false)
    private int quantity = 1;

    @Column(name = "collected_at", nullable = false, updatable = false)
    private Instant collectedAt;
}
