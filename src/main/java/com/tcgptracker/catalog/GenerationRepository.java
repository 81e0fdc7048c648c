package com.tcgptracker.catalog;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for generations.
 */
@Repository
public interface GenerationRepository extends JpaRepository<Generation, String> {

    List<Generation> findAllByOrderByNameAsc();
}
