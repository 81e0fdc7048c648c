package com.tcgptracker.catalog;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for rarity probabilities.
 */
@Repository
public interface RarityProbabilityRepository extends JpaRepository<RarityProbability, Long> {

    List<RarityProbability> findByGenerationName(String generationName);

    List<RarityProbability> findByGenerationNameAndPackTypeId(String generationName, Long packTypeId);

    List<RarityProbability> findByGenerationNameOrderByPackTypeIdAscRaritySortOrderAsc(String generationName);

    Optional<RarityProbability> findByGenerationNameAndPackTypeIdAndRarityName(
        String generationName, Long packTypeId, String rarityName);
}
