package com.tcgptracker.catalog;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for cards.
 */
@Repository
public interface CardRepository extends JpaRepository<Card, Long> {

    List<Card> findByPokemonSetIdOrderByNumberAsc(Long setId);

    Optional<Card> findByIdAndPokemonSetId(Long id, Long setId);

    boolean existsByPokemonSetIdAndNumber(Long setId, String number);

    long countByPokemonSetId(Long setId);

    long countByPokemonSetIdAndRarityName(Long setId, String rarityName);

    List<Card> findByPokemonSetIdAndRarityNameIn(Long setId, Collection<String> rarityNames);

    @Query("select c from Card c join fetch c.pokemonSet s join fetch c.rarity "
        + "where lower(c.name) like lower(concat('%', :query, '%')) "
        + "order by s.releaseDate, s.name, c.number")
    List<Card> searchByName(@Param("query") String query);

    @Query("select c from Card c join fetch c.rarity join c.packs p where p.id = :packId")
    List<Card> findByPackId(@Param("packId") Long packId);

    @Query("select c.pokemonSet.id as setId, c.rarity.name as rarityName, count(c) as total "
        + "from Card c group by c.pokemonSet.id, c.rarity.name")
    List<RarityCount> countBySetAndRarity();
}
