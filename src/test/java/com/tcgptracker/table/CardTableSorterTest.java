package com.tcgptracker.table;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CardTableSorter.
 */
class CardTableSorterTest {

    private static CardRow row(long id, String number, String name, String rarity, Integer order, boolean collected) {
        return new CardRow(id, number, name, rarity, rarity, order, collected);
    }

    private static List<Long> ids(List<CardRow> rows) {
        return rows.stream().map(CardRow::getCardId).toList();
    }

    @Test
    void testSortByNumber_ParsesLeadingInteger() {
        List<CardRow> rows = List.of(
            row(1, "010", "A", "common", 1, false),
            row(2, "2", "B", "common", 1, false),
            row(3, "001", "C", "common", 1, false));

        List<CardRow> sorted = CardTableSorter.sort(rows, SortKey.NUMBER, SortDirection.ASC);

        assertEquals(List.of(3L, 2L, 1L), ids(sorted));
        for (int i = 1; i < sorted.size(); i++) {
            assertTrue(sorted.get(i - 1).getParsedNumber() <= sorted.get(i).getParsedNumber());
        }
    }

    @Test
    void testSortByNumber_UnparsableCountsAsZero() {
        List<CardRow> rows = List.of(
            row(1, "5", "A", "common", 1, false),
            row(2, "P-A", "Promo", "common", 1, false));

        List<CardRow> sorted = CardTableSorter.sort(rows, SortKey.NUMBER, SortDirection.ASC);

        assertEquals(List.of(2L, 1L), ids(sorted));
        assertEquals(0, sorted.get(0).getParsedNumber());
    }

    @Test
    void testSortDescending_ReversesAscendingOrder() {
        List<CardRow> rows = List.of(
            row(1, "3", "A", "common", 1, false),
            row(2, "1", "B", "common", 1, false),
            row(3, "2", "C", "common", 1, false));

        List<Long> asc = ids(CardTableSorter.sort(rows, SortKey.NUMBER, SortDirection.ASC));
        List<Long> desc = ids(CardTableSorter.sort(rows, SortKey.NUMBER, SortDirection.DESC));

        assertEquals(List.of(2L, 3L, 1L), asc);
        assertEquals(List.of(1L, 3L, 2L), desc);
    }

    @Test
    void testSortByName_IgnoresCase() {
        List<CardRow> rows = List.of(
            row(1, "1", "charmander", "common", 1, false),
            row(2, "2", "Bulbasaur", "common", 1, false),
            row(3, "3", "abra", "common", 1, false));

        assertEquals(List.of(3L, 2L, 1L), ids(CardTableSorter.sort(rows, SortKey.NAME, SortDirection.ASC)));
    }

    @Test
    void testSortByRarity_UnknownRarityRanksLast() {
        List<CardRow> rows = List.of(
            row(1, "1", "A", "mystery", null, false),
            row(2, "2", "B", "illustration_rare", 5, false),
            row(3, "3", "C", "common", 1, false));

        assertEquals(List.of(3L, 2L, 1L), ids(CardTableSorter.sort(rows, SortKey.RARITY, SortDirection.ASC)));
        assertEquals(CardTableSorter.UNKNOWN_RARITY_RANK, CardTableSorter.rarityRank(rows.get(0)));
    }

    @Test
    void testSortByStatus_CollectedFirstAscending() {
        List<CardRow> rows = List.of(
            row(1, "1", "A", "common", 1, false),
            row(2, "2", "B", "common", 1, true));

        assertEquals(List.of(2L, 1L), ids(CardTableSorter.sort(rows, SortKey.STATUS, SortDirection.ASC)));
        assertEquals(List.of(1L, 2L), ids(CardTableSorter.sort(rows, SortKey.STATUS, SortDirection.DESC)));
    }

    @Test
    void testSort_IsStableForEqualKeys() {
        List<CardRow> rows = List.of(
            row(1, "1", "A", "common", 1, true),
            row(2, "2", "B", "common", 1, false),
            row(3, "3", "C", "common", 1, true),
            row(4, "4", "D", "common", 1, false));

        assertEquals(List.of(1L, 2L, 3L, 4L), ids(CardTableSorter.sort(rows, SortKey.RARITY, SortDirection.ASC)));
        assertEquals(List.of(1L, 2L, 3L, 4L), ids(CardTableSorter.sort(rows, SortKey.RARITY, SortDirection.DESC)));
        assertEquals(List.of(1L, 3L, 2L, 4L), ids(CardTableSorter.sort(rows, SortKey.STATUS, SortDirection.ASC)));
    }

    @Test
    void testSort_DoesNotModifyInput() {
        List<CardRow> rows = List.of(
            row(1, "2", "A", "common", 1, false),
            row(2, "1", "B", "common", 1, false));

        CardTableSorter.sort(rows, SortState.initial());

        assertEquals(List.of(1L, 2L), ids(rows));
    }
}
