package com.tcgptracker.collection;

import com.tcgptracker.CatalogFixtures;
import com.tcgptracker.catalog.Card;
import com.tcgptracker.catalog.Generation;
import com.tcgptracker.catalog.PokemonSet;
import com.tcgptracker.users.AppUser;
import com.tcgptracker.users.UserAccountService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for collecting and uncollecting cards.
 */
@SpringBootTest
@ActiveProfiles("test")
@Transactional
class CollectionServiceTest {

    @Autowired
    private CollectionService collectionService;

    @Autowired
    private UserAccountService userAccountService;

    @Autowired
    private UserCardRepository userCardRepository;

    @Autowired
    private CatalogFixtures fixtures;

    private AppUser user;
    private PokemonSet set;
    private Card bulbasaur;
    private Card ivysaur;
    private Card pikachuIllustration;

    @BeforeEach
    void setUp() {
        fixtures.rarities();
        Generation generation = fixtures.generation();
        set = fixtures.set("A1", "Genetic Apex", LocalDate.of(2024, 10, 30), generation);
        bulbasaur = fixtures.card(set, "001", "Bulbasaur", "common");
        ivysaur = fixtures.card(set, "002", "Ivysaur", "uncommon");
        pikachuIllustration = fixtures.card(set, "227", "Pikachu", "illustration_rare");

        user = userAccountService.register("ash", "ash@example.com", "pikachu-123");
    }

    @Test
    void testCollect() {
        assertTrue(collectionService.collect(user, bulbasaur));

        assertTrue(collectionService.isCollected(user, bulbasaur));
        assertFalse(collectionService.isCollected(user, ivysaur));
    }

    @Test
    void testCollect_Idempotent() {
        collectionService.collect(user, bulbasaur);
        assertTrue(collectionService.collect(user, bulbasaur));

        assertEquals(Set.of(bulbasaur.getId()), collectionService.getCollectedCardIds(user));
    }

    @Test
    void testCollect_RowInsertedByConcurrentRequest() {
        assertEquals(1, userCardRepository.insertIfAbsent(user.getId(), bulbasaur.getId()));

        assertTrue(collectionService.collect(user, bulbasaur));

        assertEquals(0, userCardRepository.insertIfAbsent(user.getId(), bulbasaur.getId()));
        assertEquals(1, userCardRepository.count());
        assertTrue(collectionService.isCollected(user, bulbasaur));
    }

    @Test
    void testUncollect() {
        collectionService.collect(user, bulbasaur);

        assertFalse(collectionService.uncollect(user, bulbasaur));

        assertFalse(collectionService.isCollected(user, bulbasaur));
        assertTrue(collectionService.getCollectedCardIds(user).isEmpty());
    }

    @Test
    void testUncollect_NotCollected() {
        assertFalse(collectionService.uncollect(user, ivysaur));
        assertFalse(collectionService.isCollected(user, ivysaur));
    }

    @Test
    void testApply_UsesAction() {
        assertTrue(collectionService.apply(user, ivysaur, CollectionAction.COLLECT));
        assertFalse(collectionService.apply(user, ivysaur, CollectionAction.UNCOLLECT));
        assertFalse(collectionService.isCollected(user, ivysaur));
    }

    @Test
    void testCollectedCardIds_ScopedToUserAndSet() {
        AppUser other = userAccountService.register("misty", "misty@example.com", "staryu-123");
        PokemonSet otherSet = fixtures.set("A1a", "Mythical Island", LocalDate.of(2024, 12, 17), null);
        Card celebi = fixtures.card(otherSet, "003", "Celebi ex", "rare");

        collectionService.collect(user, bulbasaur);
        collectionService.collect(user, celebi);
        collectionService.collect(other, ivysaur);

        assertEquals(Set.of(bulbasaur.getId(), celebi.getId()), collectionService.getCollectedCardIds(user));
        assertEquals(Set.of(bulbasaur.getId()), collectionService.getCollectedCardIds(user, set));
        assertEquals(Set.of(ivysaur.getId()), collectionService.getCollectedCardIds(other));
    }

    @Test
    void testCollectRarities_OnlyMissingCards() {
        collectionService.collect(user, bulbasaur);

        List<Card> collected = collectionService.collectRarities(user, set, List.of("common", "uncommon"));

        assertEquals(1, collected.size());
        assertEquals(ivysaur.getId(), collected.get(0).getId());
        assertEquals(Set.of(bulbasaur.getId(), ivysaur.getId()), collectionService.getCollectedCardIds(user, set));
        assertFalse(collectionService.isCollected(user, pikachuIllustration));
    }

    @Test
    void testCollectRarities_NothingMissing() {
        collectionService.collectRarities(user, set, List.of("common"));

        List<Card> collected = collectionService.collectRarities(user, set, List.of("common"));

        assertTrue(collected.isEmpty());
    }
}
