package com.tcgptracker.collection;

import com.tcgptracker.catalog.CardRepository;
import com.tcgptracker.catalog.PokemonSet;
import com.tcgptracker.catalog.Rarity;
import com.tcgptracker.catalog.RarityCount;
import com.tcgptracker.catalog.RarityRepository;
import com.tcgptracker.users.AppUser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Computes collection progress per set and per rarity group.
 *
 * Rarities sharing an image name form one group (all diamond rarities share the diamond
 * symbol, for example). Groups are ordered by the lowest sort order of their rarities and
 * only rarities that occur on at least one card are considered.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProgressService {

    private final CardRepository cardRepository;
    private final UserCardRepository userCardRepository;
    private final RarityRepository rarityRepository;

    @Transactional(readOnly = true)
    public SetProgress getSetProgress(AppUser user, PokemonSet set) {
        return getSetProgress(user, List.of(set)).get(0);
    }

    @Transactional(readOnly = true)
    public List<SetProgress> getSetProgress(AppUser user, List<PokemonSet> sets) {
        Map<Long, Map<String, Long>> totals = bySet(cardRepository.countBySetAndRarity());
        Map<Long, Map<String, Long>> collected = bySet(userCardRepository.countCollectedBySetAndRarity(user.getId()));

        Set<String> usedRarities = totals.values().stream()
            .flatMap(counts -> counts.keySet().stream())
            .collect(Collectors.toSet());
        Map<String, List<Rarity>> groups = groupRarities(rarityRepository.findAllByOrderBySortOrderAsc(), usedRarities);

        List<SetProgress> result = new ArrayList<>(sets.size());
        for (PokemonSet set : sets) {
            Map<String, Long> setTotals = totals.getOrDefault(set.getId(), Map.of());
            Map<String, Long> setCollected = collected.getOrDefault(set.getId(), Map.of());

            List<RarityGroupProgress> rarityProgress = new ArrayList<>(groups.size());
            for (Map.Entry<String, List<Rarity>> group : groups.entrySet()) {
                rarityProgress.add(groupProgress(group.getKey(), group.getValue(), setCollected, setTotals));
            }

            result.add(new SetProgress(set, sum(setCollected), sum(setTotals), rarityProgress));
        }
        log.debug("Computed progress of {} sets for {}", sets.size(), user.getUsername());
        return result;
    }

    /**
     * Group rarities by image name, keeping the order of the (already sorted) input.
     * Rarities without an image form a group of their own.
     */
    static Map<String, List<Rarity>> groupRarities(List<Rarity> sortedRarities, Set<String> usedRarities) {
        Map<String, List<Rarity>> groups = new LinkedHashMap<>();
        for (Rarity rarity : sortedRarities) {
            if (!usedRarities.contains(rarity.getName())) {
                continue;
            }
            String key = rarity.getImageName() != null ? rarity.getImageName() : rarity.getName();
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(rarity);
        }
        return groups;
    }

    private static RarityGroupProgress groupProgress(String key, List<Rarity> rarities,
                                                     Map<String, Long> collected, Map<String, Long> totals) {
        long groupCollected = 0;
        long groupTotal = 0;
        for (Rarity rarity : rarities) {
            groupCollected += collected.getOrDefault(rarity.getName(), 0L);
            groupTotal += totals.getOrDefault(rarity.getName(), 0L);
        }
        Rarity first = rarities.get(0);
        String label = rarities.stream().map(Rarity::getDisplayName).collect(Collectors.joining(" "));
        return new RarityGroupProgress(key, first.getImageName(), label, first.getRepeatCount(),
            groupCollected, groupTotal);
    }

    private static Map<Long, Map<String, Long>> bySet(List<RarityCount> counts) {
        Map<Long, Map<String, Long>> result = new HashMap<>();
        for (RarityCount count : counts) {
            result.computeIfAbsent(count.getSetId(), id -> new HashMap<>())
                .merge(count.getRarityName(), count.getTotal(), Long::sum);
        }
        return result;
    }

    private static long sum(Map<String, Long> counts) {
        return counts.values().stream().mapToLong(Long::longValue).sum();
    }
}
