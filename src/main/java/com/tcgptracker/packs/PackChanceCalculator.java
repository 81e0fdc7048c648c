package com.tcgptracker.packs;

import com.tcgptracker.catalog.Card;
import com.tcgptracker.catalog.CardRepository;
import com.tcgptracker.catalog.Generation;
import com.tcgptracker.catalog.Pack;
import com.tcgptracker.catalog.PackType;
import com.tcgptracker.catalog.PackTypeRepository;
import com.tcgptracker.catalog.RarityProbability;
import com.tcgptracker.catalog.RarityProbabilityRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Estimates the chance that opening a pack yields at least one card the user does not own.
 *
 * For each active slot the chance of drawing an owned card is the sum, over rarities with
 * cards in the pack, of P(rarity in slot) times the owned share of that rarity's cards.
 * Slots are independent, so the chance of nothing new is the product over slots.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PackChanceCalculator {

    private final CardRepository cardRepository;
    private final PackTypeRepository packTypeRepository;
    private final RarityProbabilityRepository probabilityRepository;

    /**
     * Chance of a new card weighted over the pack types of the pack's generation.
     * Without pack types the generation's probabilities are used over the default five slots.
     */
    @Transactional(readOnly = true)
    public double expectedChance(Pack pack, Set<Long> ownedCardIds) {
        Generation generation = pack.getRarityGeneration();
        List<Card> cards = cardRepository.findByPackId(pack.getId());
        List<PackType> packTypes =
            packTypeRepository.findByGenerationNameOrderByOccurrenceProbabilityDesc(generation.getName());

        if (packTypes.isEmpty()) {
            SlotProbabilities probabilities = fromRows(
                probabilityRepository.findByGenerationName(generation.getName()), PackType.DEFAULT_SLOT_COUNT);
            return chanceOfNewCard(cards, ownedCardIds, probabilities);
        }

        double expected = 0.0;
        for (PackType packType : packTypes) {
            double chance = chanceOfNewCard(cards, ownedCardIds, slotProbabilities(pack, packType));
            expected += chance * packType.getOccurrenceProbability();
        }
        return expected;
    }

    @Transactional(readOnly = true)
    public double chanceOfNewCard(Pack pack, Set<Long> ownedCardIds, PackType packType) {
        List<Card> cards = cardRepository.findByPackId(pack.getId());
        return chanceOfNewCard(cards, ownedCardIds, slotProbabilities(pack, packType));
    }

    /**
     * Stored probabilities for normal pack types, card-count based ones for god packs.
     */
    @Transactional(readOnly = true)
    public SlotProbabilities slotProbabilities(Pack pack, PackType packType) {
        if (packType.isGodPack()) {
            return godPackProbabilities(pack, packType);
        }
        List<RarityProbability> rows = probabilityRepository.findByGenerationNameAndPackTypeId(
            packType.getGeneration().getName(), packType.getId());
        return fromRows(rows, packType.getSlotCount());
    }

    /**
     * God packs only contain eligible rarities; each rarity's chance per slot is its share
     * of the eligible cards in the set.
     */
    SlotProbabilities godPackProbabilities(Pack pack, PackType packType) {
        Long setId = pack.getPokemonSet().getId();
        Map<String, Long> counts = new HashMap<>();
        long totalRareCards = 0;
        for (String rarityName : packType.getGeneration().getGodPackEligibleRarityNames()) {
            long count = cardRepository.countByPokemonSetIdAndRarityName(setId, rarityName);
            counts.put(rarityName, count);
            totalRareCards += count;
        }

        SlotProbabilities.Builder builder = SlotProbabilities.builder(packType.getSlotCount());
        if (totalRareCards == 0) {
            return builder.build();
        }
        for (Map.Entry<String, Long> entry : counts.entrySet()) {
            if (entry.getValue() == 0) {
                continue;
            }
            double[] slots = new double[RarityProbability.MAX_SLOTS];
            double share = (double) entry.getValue() / totalRareCards;
            for (int i = 0; i < Math.min(packType.getSlotCount(), slots.length); i++) {
                slots[i] = share;
            }
            builder.rarity(entry.getKey(), slots);
        }
        return builder.build();
    }

    /**
     * @return chance in [0, 1] rounded to 4 decimals; 0 when no probabilities are known
     */
    static double chanceOfNewCard(List<Card> cardsInPack, Set<Long> ownedCardIds, SlotProbabilities probabilities) {
        if (probabilities.isEmpty()) {
            return 0.0;
        }

        Map<String, Integer> totalByRarity = new HashMap<>();
        Map<String, Integer> ownedByRarity = new HashMap<>();
        for (Card card : cardsInPack) {
            String rarity = card.getRarity().getName();
            totalByRarity.merge(rarity, 1, Integer::sum);
            if (ownedCardIds.contains(card.getId())) {
                ownedByRarity.merge(rarity, 1, Integer::sum);
            }
        }

        double probNoNew = 1.0;
        for (int slot = 1; slot <= probabilities.getSlotCount(); slot++) {
            double slotProbNoNew = 0.0;
            for (String rarity : probabilities.asMap().keySet()) {
                int total = totalByRarity.getOrDefault(rarity, 0);
                if (total == 0) {
                    continue;
                }
                int owned = ownedByRarity.getOrDefault(rarity, 0);
                slotProbNoNew += probabilities.get(rarity, slot) * ((double) owned / total);
            }
            probNoNew *= slotProbNoNew;
        }
        return round(1.0 - probNoNew, 4);
    }

    private static SlotProbabilities fromRows(List<RarityProbability> rows, int slotCount) {
        SlotProbabilities.Builder builder = SlotProbabilities.builder(slotCount);
        for (RarityProbability row : rows) {
            double[] slots = row.getSlotProbabilities().stream().mapToDouble(Double::doubleValue).toArray();
            builder.rarity(row.getRarity().getName(), slots);
        }
        return builder.build();
    }

    static double round(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
