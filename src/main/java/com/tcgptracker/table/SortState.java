package com.tcgptracker.table;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Which column the table is sorted by, plus the last direction used for every column.
 *
 * Clicking a header flips the direction remembered for that column; a column that has
 * never been sorted starts ascending. Instances are immutable.
 */
public final class SortState {

    private final SortKey activeKey;
    private final Map<SortKey, SortDirection> directions;

    private SortState(SortKey activeKey, Map<SortKey, SortDirection> directions) {
        this.activeKey = activeKey;
        this.directions = Collections.unmodifiableMap(new EnumMap<>(directions));
    }

    /**
     * Cards are initially shown by number, ascending.
     */
    public static SortState initial() {
        return of(SortKey.NUMBER, SortDirection.ASC);
    }

    public static SortState of(SortKey key, SortDirection direction) {
        Map<SortKey, SortDirection> directions = new EnumMap<>(SortKey.class);
        directions.put(key, direction);
        return new SortState(key, directions);
    }

    public SortState toggle(SortKey clicked) {
        SortDirection next = directions.get(clicked) == SortDirection.ASC ? SortDirection.DESC : SortDirection.ASC;
        Map<SortKey, SortDirection> updated = new EnumMap<>(SortKey.class);
        updated.putAll(directions);
        updated.put(clicked, next);
        return new SortState(clicked, updated);
    }

    public SortKey getActiveKey() {
        return activeKey;
    }

    public SortDirection getActiveDirection() {
        return directions.get(activeKey);
    }

    /**
     * Arrow shown in a header: only the active column carries one.
     */
    public String arrowFor(SortKey key) {
        return key == activeKey ? getActiveDirection().getArrow() : "";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SortState other)) {
            return false;
        }
        return activeKey == other.activeKey && directions.equals(other.directions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(activeKey, directions);
    }

    @Override
    public String toString() {
        return "SortState(" + activeKey + " " + getActiveDirection() + ")";
    }
}
