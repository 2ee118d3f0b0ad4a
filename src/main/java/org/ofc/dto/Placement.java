package org.ofc.dto;

import org.ofc.model.Card;
import org.ofc.model.Row;
import org.ofc.model.Slot;

public record Placement(Card card, Slot slot) {

    public static Placement of(String card, Row row, int index) {
        return new Placement(Card.parse(card), Slot.of(row, index));
    }

    public Row row() { return slot.row(); }
}
