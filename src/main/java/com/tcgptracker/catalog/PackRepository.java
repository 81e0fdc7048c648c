package com.tcgptracker.catalog;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Repository for packs.
 */
@Repository
public interface PackRepository extends JpaRepository<Pack, Long> {

    /**
     * Packs of sets that are still available on the given day.
     */
    @Query("select distinct p from Pack p "
        + "join fetch p.pokemonSet s "
        + "join fetch p.rarityGeneration "
        + "where s.availableUntil is null or s.availableUntil >= :today "
        + "order by s.releaseDate, p.name")
    List<Pack> findAvailable(@Param("today") LocalDate today);

    Optional<Pack> findByPokemonSetNumberAndName(String setNumber, String name);
}
