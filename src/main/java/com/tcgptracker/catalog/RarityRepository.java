package com.tcgptracker.catalog;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for rarities.
 */
@Repository
public interface RarityRepository extends JpaRepository<Rarity, String> {

    List<Rarity> findAllByOrderBySortOrderAsc();
}
