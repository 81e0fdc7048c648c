package com.tcgptracker.catalog;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for sets.
 */
@Repository
public interface PokemonSetRepository extends JpaRepository<PokemonSet, Long> {

    Optional<PokemonSet> findByNumber(String number);

    List<PokemonSet> findAllByOrderByReleaseDateDesc();

    List<PokemonSet> findAllByOrderByReleaseDateAsc();
}
