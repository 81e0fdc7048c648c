package com.tcgptracker.admin;

import com.tcgptracker.catalog.Generation;
import com.tcgptracker.catalog.GenerationRepository;
import com.tcgptracker.catalog.PackType;
import com.tcgptracker.catalog.PackTypeRepository;
import com.tcgptracker.catalog.PokemonSet;
import com.tcgptracker.catalog.PokemonSetRepository;
import com.tcgptracker.catalog.Rarity;
import com.tcgptracker.catalog.RarityProbability;
import com.tcgptracker.catalog.RarityProbabilityRepository;
import com.tcgptracker.catalog.RarityRepository;
import com.tcgptracker.common.exception.GenerationNotFoundException;
import com.tcgptracker.common.exception.RarityProbabilityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Admin maintenance of the catalog's rarity probabilities.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RarityProbabilityAdminService {

    private final GenerationRepository generationRepository;
    private final PackTypeRepository packTypeRepository;
    private final RarityRepository rarityRepository;
    private final RarityProbabilityRepository probabilityRepository;
    private final PokemonSetRepository setRepository;

    @Transactional(readOnly = true)
    public List<PokemonSet> getSets() {
        return setRepository.findAllByOrderByReleaseDateAsc();
    }

    @Transactional(readOnly = true)
    public List<Generation> getGenerations() {
        return generationRepository.findAllByOrderByNameAsc();
    }

    @Transactional(readOnly = true)
    public Generation getGeneration(String name) {
        return generationRepository.findById(name)
            .orElseThrow(() -> new GenerationNotFoundException(name));
    }

    @Transactional(readOnly = true)
    public List<PackType> getPackTypes(String generationName) {
        return packTypeRepository.findByGenerationNameOrderByOccurrenceProbabilityDesc(generationName);
    }

    @Transactional(readOnly = true)
    public List<Rarity> getRarities() {
        return rarityRepository.findAllByOrderBySortOrderAsc();
    }

    /**
     * Stored probability rows of a generation; god pack rows are left out since those
     * probabilities are derived from card counts.
     */
    @Transactional(readOnly = true)
    public List<RarityProbability> getProbabilities(String generationName) {
        return probabilityRepository.findByGenerationNameOrderByPackTypeIdAscRaritySortOrderAsc(generationName)
            .stream()
            .filter(row -> !row.getPackType().isGodPack())
            .toList();
    }

    @Transactional(readOnly = true)
    public RarityProbability getProbability(Long id) {
        return probabilityRepository.findById(id)
            .orElseThrow(() -> new RarityProbabilityNotFoundException(id));
    }

    /**
     * Create or update a probability row. An existing row for the same pack type and
     * rarity is updated instead of duplicated.
     */
    @Transactional
    public RarityProbability save(String generationName, RarityProbabilityForm form) {
        Generation generation = getGeneration(generationName);
        PackType packType = packTypeRepository.findById(form.getPackTypeId())
            .filter(pt -> pt.getGeneration().getName().equals(generationName))
            .orElseThrow(() -> new IllegalArgumentException(
                "Pack type " + form.getPackTypeId() + " does not belong to generation " + generationName));
        Rarity rarity = rarityRepository.findById(form.getRarityName())
            .orElseThrow(() -> new IllegalArgumentException("Unknown rarity: " + form.getRarityName()));

        RarityProbability row;
        if (form.getId() != null) {
            row = getProbability(form.getId());
            row.setPackType(packType);
            row.setRarity(rarity);
        } else {
            row = probabilityRepository
                .findByGenerationNameAndPackTypeIdAndRarityName(generationName, packType.getId(), rarity.getName())
                .orElseGet(() -> new RarityProbability(rarity, generation, packType));
        }
        row.setSlotProbabilities(form.getSlotProbabilities());

        RarityProbability saved = probabilityRepository.save(row);
        log.info("Saved rarity probability {} for {} - {} - {}",
            saved.getId(), generationName, packType.getName(), rarity.getName());
        return saved;
    }
}
