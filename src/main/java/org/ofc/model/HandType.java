package org.ofc.model;

import lombok.Getter;

/** Poker hand categories, weakest first. A royal flush is an ace-high {@link #STRAIGHT_FLUSH}. */
@Getter
public enum HandType {
    HIGH_CARD("High Card"),
    PAIR("Pair"),
    TWO_PAIR("Two Pair"),
    TRIPS("Three of a Kind"),
    STRAIGHT("Straight"),
    FLUSH("Flush"),
    FULL_HOUSE("Full House"),
    QUADS("Four of a Kind"),
    STRAIGHT_FLUSH("Straight Flush");

    private final String displayName;

    HandType(String displayName) { this.displayName = displayName; }

    public boolean atLeast(HandType other) { return compareTo(other) >= 0; }
}
