package com.tcgptracker.table;

import com.tcgptracker.catalog.Card;
import lombok.Getter;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The card table of a set page: rows after sorting and filtering, plus the state that
 * produced them.
 */
@Getter
public class CardTable {

    private final List<CardRow> rows;
    private final SortState sortState;
    private final String filter;

    private CardTable(List<CardRow> rows, SortState sortState, String filter) {
        this.rows = rows;
        this.sortState = sortState;
        this.filter = filter;
    }

    public static CardTable of(List<Card> cards, Set<Long> collectedCardIds, SortState sortState, String filter) {
        List<CardRow> rows = cards.stream()
            .map(card -> CardRow.of(card, collectedCardIds.contains(card.getId())))
            .toList();
        List<CardRow> visible = CardRowFilter.filter(CardTableSorter.sort(rows, sortState), filter);
        return new CardTable(visible, sortState, filter == null ? "" : filter);
    }

    /**
     * Rows a bulk collect would request: rarity among the given ones and not yet collected.
     */
    public List<CardRow> rowsToCollect(Collection<String> rarityNames) {
        return rows.stream()
            .filter(row -> rarityNames.contains(row.getRarityName()))
            .filter(row -> !row.isCollected())
            .toList();
    }

    /**
     * The first row, in display order, of the given rarity.
     */
    public Optional<CardRow> firstRowOfRarity(String rarityName) {
        return rows.stream()
            .filter(row -> rarityName.equals(row.getRarityName()))
            .findFirst();
    }

    /**
     * The sort state a click on the given header would produce.
     */
    public SortState headerTarget(SortKey key) {
        return sortState.toggle(key);
    }
}
