package com.tcgptracker.table;

import com.tcgptracker.catalog.Card;
import com.tcgptracker.collection.CollectionAction;
import lombok.Value;

import java.util.List;

/**
 * One row of the set-detail card table.
 */
@Value
public class CardRow {

    public static final String COLLECTED_ICON = "✅";
    public static final String UNCOLLECTED_ICON = "❌";

    Long cardId;
    String number;
    String name;
    String rarityName;
    String rarityDisplayName;
    Integer raritySortOrder;
    boolean collected;

    public static CardRow of(Card card, boolean collected) {
        return new CardRow(
            card.getId(),
            card.getNumber(),
            card.getName(),
            card.getRarity().getName(),
            card.getRarity().getDisplayName(),
            card.getRarity().getSortOrder(),
            collected
        );
    }

    public String getStatusIcon() {
        return collected ? COLLECTED_ICON : UNCOLLECTED_ICON;
    }

    /**
     * The action a click on this row triggers.
     */
    public String getAction() {
        return CollectionAction.nextFor(collected).getParameter();
    }

    /**
     * Cell texts in column order: number, name, rarity, status.
     */
    public List<String> getCellTexts() {
        return List.of(
            nullToEmpty(number),
            nullToEmpty(name),
            nullToEmpty(rarityDisplayName),
            getStatusIcon()
        );
    }

    /**
     * Leading integer of the card number, 0 when the number does not start with digits.
     */
    public int getParsedNumber() {
        return CardNumbers.parseLeadingInt(number);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
