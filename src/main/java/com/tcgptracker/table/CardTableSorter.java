package com.tcgptracker.table;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Sorts card table rows by a column.
 *
 * Sorting is stable in both directions: rows with equal keys keep their relative order.
 */
public final class CardTableSorter {

    /**
     * Rank used for rows whose rarity has no known order.
     */
    public static final int UNKNOWN_RARITY_RANK = 99;

    private CardTableSorter() {
    }

    public static List<CardRow> sort(List<CardRow> rows, SortKey key, SortDirection direction) {
        Comparator<CardRow> comparator = comparatorFor(key);
        if (direction == SortDirection.DESC) {
            comparator = comparator.reversed();
        }
        List<CardRow> sorted = new ArrayList<>(rows);
        sorted.sort(comparator);
        return sorted;
    }

    public static List<CardRow> sort(List<CardRow> rows, SortState state) {
        return sort(rows, state.getActiveKey(), state.getActiveDirection());
    }

    static Comparator<CardRow> comparatorFor(SortKey key) {
        return switch (key) {
            case NUMBER -> Comparator.comparingInt(CardRow::getParsedNumber);
            case NAME -> Comparator.comparing(CardTableSorter::normalizedName);
            case RARITY -> Comparator.comparingInt(CardTableSorter::rarityRank);
            case STATUS -> Comparator.comparing(CardRow::getStatusIcon);
        };
    }

    static int rarityRank(CardRow row) {
        return row.getRaritySortOrder() != null ? row.getRaritySortOrder() : UNKNOWN_RARITY_RANK;
    }

    private static String normalizedName(CardRow row) {
        return row.getName() == null ? "" : row.getName().trim().toLowerCase(Locale.ROOT);
    }
}
