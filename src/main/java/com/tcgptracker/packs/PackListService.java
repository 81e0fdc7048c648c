package com.tcgptracker.packs;

import com.tcgptracker.catalog.Card;
import com.tcgptracker.catalog.CardRepository;
import com.tcgptracker.catalog.Pack;
import com.tcgptracker.catalog.PackRepository;
import com.tcgptracker.collection.CollectionService;
import com.tcgptracker.collection.SetProgress;
import com.tcgptracker.config.TrackerProperties;
import com.tcgptracker.users.AppUser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the pack list: every pack of a still available set with ownership stats and
 * the chance of pulling something new.
 *
 * Packs still missing base cards come first, then higher chance, then name.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PackListService {

    private static final Comparator<PackSummary> PACK_ORDER = Comparator
        .comparing((PackSummary p) -> !p.isIncompleteBase())
        .thenComparing(PackSummary::getChance, Comparator.reverseOrder())
        .thenComparing(p -> p.getPack().getName());

    private final PackRepository packRepository;
    private final CardRepository cardRepository;
    private final CollectionService collectionService;
    private final PackChanceCalculator chanceCalculator;
    private final TrackerProperties properties;

    @Transactional(readOnly = true)
    public List<PackGroup> getPackList(AppUser user) {
        return getPackList(user, LocalDate.now());
    }

    @Transactional(readOnly = true)
    public List<PackGroup> getPackList(AppUser user, LocalDate today) {
        List<Pack> packs = packRepository.findAvailable(today);
        Set<Long> owned = collectionService.getCollectedCardIds(user);
        Set<String> baseRarities = Set.copyOf(properties.getUi().getBaseRarities());

        List<PackStats> stats = new ArrayList<>(packs.size());
        for (Pack pack : packs) {
            stats.add(statsFor(pack, owned, baseRarities));
        }

        PackStats best = stats.stream()
            .max(Comparator.comparingDouble(PackStats::chance))
            .orElse(null);

        List<PackSummary> summaries = stats.stream()
            .map(s -> s.toSummary(s == best))
            .sorted(PACK_ORDER)
            .toList();

        Map<Long, PackGroup> groups = new LinkedHashMap<>();
        for (PackSummary summary : summaries) {
            groups.computeIfAbsent(summary.getPack().getPokemonSet().getId(),
                    id -> new PackGroup(summary.getPack().getPokemonSet(), new ArrayList<>()))
                .getPacks().add(summary);
        }

        log.debug("Pack list for {}: {} packs in {} sets", user.getUsername(), summaries.size(), groups.size());
        return List.copyOf(groups.values());
    }

    private PackStats statsFor(Pack pack, Set<Long> owned, Set<String> baseRarities) {
        List<Card> cards = cardRepository.findByPackId(pack.getId());
        int ownedCount = (int) cards.stream().filter(c -> owned.contains(c.getId())).count();
        boolean incompleteBase = cards.stream()
            .filter(c -> baseRarities.contains(c.getRarity().getName()))
            .anyMatch(c -> !owned.contains(c.getId()));
        double chance = PackChanceCalculator.round(chanceCalculator.expectedChance(pack, owned) * 100, 2);
        return new PackStats(pack, chance, cards.size(), ownedCount, incompleteBase);
    }

    private record PackStats(Pack pack, double chance, int total, int owned, boolean incompleteBase) {

        PackSummary toSummary(boolean best) {
            return new PackSummary(pack, chance, total, owned, SetProgress.percent(owned, total), incompleteBase, best);
        }
    }
}
