package com.tcgptracker.collection;

import com.tcgptracker.common.exception.InvalidCollectionActionException;

/**
 * What a row click or button asks the server to do with a card.
 */
public enum CollectionAction {
    COLLECT("collect"),
    UNCOLLECT("uncollect");

    private final String parameter;

    CollectionAction(String parameter) {
        this.parameter = parameter;
    }

    /**
     * The value used in form submissions ({@code action=collect}).
     */
    public String getParameter() {
        return parameter;
    }

    /**
     * The action a row offers next, given whether its card is collected.
     */
    public static CollectionAction nextFor(boolean collected) {
        return collected ? UNCOLLECT : COLLECT;
    }

    public static CollectionAction fromParameter(String value) {
        for (CollectionAction action : values()) {
            if (action.parameter.equals(value)) {
                return action;
            }
        }
        throw new InvalidCollectionActionException(value);
    }
}
