package org.ofc.exception;

import org.ofc.model.Card;
import org.ofc.model.Row;

/** A placement violates ownership or row capacity. */
public class InvalidCardPlacementException extends IllegalArgumentException {
    private final Card card;
    private final Row row;

    public InvalidCardPlacementException(String message) {
        this(message, null, null);
    }

    public InvalidCardPlacementException(String message, Card card, Row row) {
        super(message);
        this.card = card;
        this.row = row;
    }

    public Card getCard() { return card; }

    public Row getRow() { return row; }
}
