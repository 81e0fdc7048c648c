package com.tcgptracker.table;

import java.util.List;
import java.util.Locale;

/**
 * Case-insensitive substring filter over the concatenated cell texts of a row.
 */
public final class CardRowFilter {

    private CardRowFilter() {
    }

    public static boolean matches(CardRow row, String filter) {
        if (filter == null || filter.isEmpty()) {
            return true;
        }
        return rowText(row).contains(filter.toLowerCase(Locale.ROOT));
    }

    public static List<CardRow> filter(List<CardRow> rows, String filter) {
        return rows.stream()
            .filter(row -> matches(row, filter))
            .toList();
    }

    /**
     * Lower-cased cell texts joined by a single space.
     */
    static String rowText(CardRow row) {
        return String.join(" ", row.getCellTexts()).toLowerCase(Locale.ROOT);
    }
}
