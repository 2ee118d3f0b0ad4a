package org.ofc.model;

import java.util.List;

/** Copy of one player's rows and held cards at a point in time. */
public record HandSnapshot(List<Card> top, List<Card> middle, List<Card> bottom, List<Card> handCards) {
    public HandSnapshot {
        top = List.copyOf(top);
        middle = List.copyOf(middle);
        bottom = List.copyOf(bottom);
        handCards = List.copyOf(handCards);
    }

    public int placedCount() { return top.size() + middle.size() + bottom.size(); }

    public boolean isComplete() {
        return top.size() == Row.TOP.getCapacity()
                && middle.size() == Row.MIDDLE.getCapacity()
                && bottom.size() == Row.BOTTOM.getCapacity();
    }
}
