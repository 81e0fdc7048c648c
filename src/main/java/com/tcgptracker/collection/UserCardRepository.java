package com.tcgptracker.collection;

import com.tcgptracker.catalog.RarityCount;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Set;

/**
 * Repository for collection-status records.
 */
@Repository
public interface UserCardRepository extends JpaRepository<UserCard, Long> {

    /**
     * Insert the collection-status record unless one already exists.
     *
     * @return 1 if a row was inserted, 0 if the card was already collected
     */
    @Modifying
    @Query(value = "insert into user_cards (user_id, card_id, quantity, collected_at) "
        + "values (:userId, :cardId, 1, current_timestamp) on conflict do nothing", nativeQuery = true)
    int insertIfAbsent(@Param("userId") Long userId, @Param("cardId") Long cardId);

    boolean existsByUserIdAndCardId(Long userId, Long cardId);

    @Modifying
    @Query("delete from UserCard uc where uc.user.id = :userId and uc.card.id = :cardId")
    int deleteByUserIdAndCardId(@Param("userId") Long userId, @Param("cardId") Long cardId);

    @Modifying
    @Query("delete from UserCard uc where uc.user.id = :userId")
    int deleteByUserId(@Param("userId") Long userId);

    @Query("select uc.card.id from UserCard uc where uc.user.id = :userId")
    Set<Long> findCardIdsByUserId(@Param("userId") Long userId);

    @Query("select uc.card.id from UserCard uc where uc.user.id = :userId and uc.card.pokemonSet.id = :setId")
    Set<Long> findCardIdsByUserIdAndSetId(@Param("userId") Long userId, @Param("setId") Long setId);

    @Query("select c.pokemonSet.id as setId, c.rarity.name as rarityName, count(uc) as total "
        + "from UserCard uc join uc.card c where uc.user.id = :userId "
        + "group by c.pokemonSet.id, c.rarity.name")
    List<RarityCount> countCollectedBySetAndRarity(@Param("userId") Long userId);
}
