package com.tcgptracker.table;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CardRowFilterTest {

    private final List<CardRow> rows = List.of(
        new CardRow(1L, "001", "Bulbasaur", "common", "◊", 1, false),
        new CardRow(2L, "004", "Venusaur ex", "double_rare", "◊◊◊◊", 4, true),
        new CardRow(3L, "033", "Charmander", "common", "◊", 1, false));

    @Test
    void testEmptyFilter_ShowsAllRows() {
        assertEquals(3, CardRowFilter.filter(rows, "").size());
        assertEquals(3, CardRowFilter.filter(rows, null).size());
    }

    @Test
    void testFilter_SubstringInOneRow() {
        List<CardRow> result = CardRowFilter.filter(rows, "CHARM");

        assertEquals(1, result.size());
        assertEquals(3L, result.get(0).getCardId());
    }

    @Test
    void testFilter_MatchesAcrossCells() {
        // cell texts are joined by a single space
        List<CardRow> result = CardRowFilter.filter(rows, "004 venusaur");

        assertEquals(1, result.size());
        assertEquals(2L, result.get(0).getCardId());
    }

    @Test
    void testFilter_MatchesStatusIcon() {
        List<CardRow> result = CardRowFilter.filter(rows, CardRow.COLLECTED_ICON);

        assertEquals(List.of(2L), result.stream().map(CardRow::getCardId).toList());
    }

    @Test
    void testFilter_NoMatch() {
        assertTrue(CardRowFilter.filter(rows, "pikachu").isEmpty());
    }

    @Test
    void testRowText() {
        assertEquals("001 bulbasaur ◊ ❌", CardRowFilter.rowText(rows.get(0)));
    }
}
