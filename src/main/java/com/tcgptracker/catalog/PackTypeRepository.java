package com.tcgptracker.catalog;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for pack types.
 */
@Repository
public interface PackTypeRepository extends JpaRepository<PackType, Long> {

    List<PackType> findByGenerationNameOrderByOccurrenceProbabilityDesc(String generationName);

    Optional<PackType> findByGenerationNameAndName(String generationName, String name);
}
