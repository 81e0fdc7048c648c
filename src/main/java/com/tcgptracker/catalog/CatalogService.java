package com.tcgptracker.catalog;

import com.tcgptracker.common.exception.CardNotFoundException;
import com.tcgptracker.common.exception.SetNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.List;

/**
 * Read access to sets, cards and rarities.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CatalogService {

    private final PokemonSetRepository setRepository;
    private final CardRepository cardRepository;
    private final RarityRepository rarityRepository;

    @Transactional(readOnly = true)
    public PokemonSet getSet(String setNumber) {
        return setRepository.findByNumber(setNumber)
            .orElseThrow(() -> new SetNotFoundException(setNumber));
    }

    @Transactional(readOnly = true)
    public List<PokemonSet> getSetsNewestFirst() {
        return setRepository.findAllByOrderByReleaseDateDesc();
    }

    @Transactional(readOnly = true)
    public List<Card> getCards(PokemonSet set) {
        return cardRepository.findByPokemonSetIdOrderByNumberAsc(set.getId());
    }

    /**
     * Look up a card and make sure it belongs to the given set.
     */
    @Transactional(readOnly = true)
    public Card getCardInSet(Long cardId, PokemonSet set) {
        return cardRepository.findByIdAndPokemonSetId(cardId, set.getId())
            .orElseThrow(() -> new CardNotFoundException(cardId, set.getNumber()));
    }

    @Transactional(readOnly = true)
    public Card getCard(Long cardId) {
        return cardRepository.findById(cardId)
            .orElseThrow(() -> new CardNotFoundException(cardId));
    }

    /**
     * Case-insensitive search on card names, ordered by set release date, set name and card number.
     */
    @Transactional(readOnly = true)
    public List<Card> searchCards(String query) {
        if (!StringUtils.hasText(query)) {
            return List.of();
        }
        List<Card> results = cardRepository.searchByName(query.trim());
        log.debug("Card search '{}' matched {} cards", query, results.size());
        return results;
    }

    @Transactional(readOnly = true)
    public List<Rarity> getRarities() {
        return rarityRepository.findAllByOrderBySortOrderAsc();
    }
}
