package com.tcgptracker.admin;

import com.tcgptracker.catalog.PackType;
import com.tcgptracker.catalog.PackTypeRepository;
import com.tcgptracker.catalog.RarityProbability;
import com.tcgptracker.catalog.RarityProbabilityRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Checks that every active slot of a pack type sums to 1.0 across rarities.
 *
 * God pack types are skipped since their probabilities are not stored.
 * Pack types without rows are skipped as well.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProbabilitySumValidator {

    static final double EPSILON = 1e-5;

    private final PackTypeRepository packTypeRepository;
    private final RarityProbabilityRepository probabilityRepository;

    @Transactional(readOnly = true)
    public List<SlotSumWarning> validate(String generationName) {
        List<SlotSumWarning> warnings = check(
            generationName,
            packTypeRepository.findByGenerationNameOrderByOccurrenceProbabilityDesc(generationName),
            probabilityRepository.findByGenerationName(generationName));
        warnings.forEach(w -> log.warn(w.getMessage()));
        return warnings;
    }

    static List<SlotSumWarning> check(String generationName, List<PackType> packTypes,
                                      List<RarityProbability> rows) {
        List<SlotSumWarning> warnings = new ArrayList<>();
        for (PackType packType : packTypes) {
            if (packType.isGodPack()) {
                continue;
            }
            List<RarityProbability> packTypeRows = rows.stream()
                .filter(row -> Objects.equals(row.getPackType().getId(), packType.getId()))
                .toList();
            if (packTypeRows.isEmpty()) {
                continue;
            }

            int activeSlots = Math.min(packType.getSlotCount(), RarityProbability.MAX_SLOTS);
            Map<Integer, Double> drift = new LinkedHashMap<>();
            for (int slot = 1; slot <= activeSlots; slot++) {
                double total = 0.0;
                for (RarityProbability row : packTypeRows) {
                    total += row.getSlotProbability(slot);
                }
                if (Math.abs(total - 1.0) > EPSILON) {
                    drift.put(slot, total);
                }
            }
            if (!drift.isEmpty()) {
                warnings.add(new SlotSumWarning(generationName, packType.getName(), drift));
            }
        }
        return warnings;
    }
}
