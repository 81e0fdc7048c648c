package com.tcgptracker.admin;

import java.util.ArrayList;
import java.util.List;

/**
 * Which probability rows the rarity probability form shows for a pack type.
 *
 * Slots 1..5 are optional rows; a pack type with slot count N shows the first N.
 * The same rule runs in the browser when the pack type selection changes.
 */
public final class SlotFieldVisibility {

    public static final int OPTIONAL_SLOT_ROWS = 5;

    private SlotFieldVisibility() {
    }

    public static boolean isVisible(int slot, int slotCount) {
        return slot <= slotCount;
    }

    /**
     * Visibility of rows 1..5, index 0 being slot 1.
     */
    public static List<Boolean> visibleRows(int slotCount) {
        List<Boolean> rows = new ArrayList<>(OPTIONAL_SLOT_ROWS);
        for (int slot = 1; slot <= OPTIONAL_SLOT_ROWS; slot++) {
            rows.add(isVisible(slot, slotCount));
        }
        return rows;
    }
}
