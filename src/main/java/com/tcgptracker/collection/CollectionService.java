package com.tcgptracker.collection;

import com.tcgptracker.catalog.Card;
import com.tcgptracker.catalog.CardRepository;
import com.tcgptracker.catalog.PokemonSet;
import com.tcgptracker.users.AppUser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Service for collecting and uncollecting cards.
 *
 * Both operations are idempotent: collecting an owned card keeps the existing record,
 * uncollecting a missing card does nothing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CollectionService {

    private final UserCardRepository userCardRepository;
    private final CardRepository cardRepository;

    /**
     * Apply an action to a card.
     *
     * @return whether the card is collected afterwards
     */
    @Transactional
    public boolean apply(AppUser user, Card card, CollectionAction action) {
        return switch (action) {
            case COLLECT -> collect(user, card);
            case UNCOLLECT -> uncollect(user, card);
        };
    }

    /**
     * Collect a card. Concurrent collects of the same card insert a single row.
     */
    @Transactional
    public boolean collect(AppUser user, Card card) {
        if (userCardRepository.insertIfAbsent(user.getId(), card.getId()) == 0) {
            log.debug("Card {} already collected by {}", card.getId(), user.getUsername());
            return true;
        }
        log.info("Collected card {} ({}) for {}", card.getId(), card.getName(), user.getUsername());
        return true;
    }

    @Transactional
    public boolean uncollect(AppUser user, Card card) {
        int removed = userCardRepository.deleteByUserIdAndCardId(user.getId(), card.getId());
        if (removed > 0) {
            log.info("Uncollected card {} ({}) for {}", card.getId(), card.getName(), user.getUsername());
        }
        return false;
    }

    @Transactional(readOnly = true)
    public boolean isCollected(AppUser user, Card card) {
        return userCardRepository.existsByUserIdAndCardId(user.getId(), card.getId());
    }

    @Transactional(readOnly = true)
    public Set<Long> getCollectedCardIds(AppUser user) {
        return userCardRepository.findCardIdsByUserId(user.getId());
    }

    @Transactional(readOnly = true)
    public Set<Long> getCollectedCardIds(AppUser user, PokemonSet set) {
        return userCardRepository.findCardIdsByUserIdAndSetId(user.getId(), set.getId());
    }

    /**
     * Collect every not yet collected card of the given rarities in a set.
     *
     * @return the cards that were newly collected
     */
    @Transactional
    public List<Card> collectRarities(AppUser user, PokemonSet set, Collection<String> rarityNames) {
        Set<Long> owned = getCollectedCardIds(user, set);
        List<Card> newlyCollected = cardRepository.findByPokemonSetIdAndRarityNameIn(set.getId(), rarityNames)
            .stream()
            .filter(card -> !owned.contains(card.getId()))
            .toList();
        newlyCollected.forEach(card -> userCardRepository.insertIfAbsent(user.getId(), card.getId()));

        log.info("Collected {} cards of rarities {} in set {} for {}",
            newlyCollected.size(), rarityNames, set.getNumber(), user.getUsername());
        return newlyCollected;
    }
}
