package com.tcgptracker.table;

/**
 * Sortable columns of the card table.
 */
public enum SortKey {
    NUMBER("number", "#"),
    NAME("name", "Name"),
    RARITY("rarity", "Rarity"),
    STATUS("status", "Status");

    private final String parameter;
    private final String label;

    SortKey(String parameter, String label) {
        this.parameter = parameter;
        this.label = label;
    }

    /**
     * The value of the header's {@code data-sort} attribute and of the {@code sort} query parameter.
     */
    public String getParameter() {
        return parameter;
    }

    public String getLabel() {
        return label;
    }

    public static SortKey fromParameter(String value, SortKey fallback) {
        if (value == null) {
            return fallback;
        }
        for (SortKey key : values()) {
            if (key.parameter.equalsIgnoreCase(value.trim())) {
                return key;
            }
        }
        return fallback;
    }
}
