package com.tcgptracker.table;

/**
 * Sort direction of a card table column.
 */
public enum SortDirection {
    ASC("asc", "▲"),
    DESC("desc", "▼");

    private final String parameter;
    private final String arrow;

    SortDirection(String parameter, String arrow) {
        this.parameter = parameter;
        this.arrow = arrow;
    }

    public String getParameter() {
        return parameter;
    }

    public String getArrow() {
        return arrow;
    }

    public SortDirection opposite() {
        return this == ASC ? DESC : ASC;
    }

    public static SortDirection fromParameter(String value, SortDirection fallback) {
        if (value == null) {
            return fallback;
        }
        for (SortDirection direction : values()) {
            if (direction.parameter.equalsIgnoreCase(value.trim())) {
                return direction;
            }
        }
        return fallback;
    }
}
