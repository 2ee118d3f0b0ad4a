package org.ofc.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of evaluating a 3- or 5-card row.
 *
 * @param handType      category of the hand
 * @param tiebreakKey   ranks compared left to right when categories are equal
 * @param strengthValue single comparable encoding of type and tiebreak key
 * @param royaltyBonus  royalty points for the row the hand was evaluated for
 * @param cards         the evaluated cards
 */
public record HandRanking(HandType handType,
                          List<Card.Rank> tiebreakKey,
                          long strengthValue,
                          int royaltyBonus,
                          List<Card> cards) implements Comparable<HandRanking> {

    public HandRanking {
        tiebreakKey = List.copyOf(tiebreakKey);
        cards = List.copyOf(cards);
        if (royaltyBonus < 0) throw new IllegalArgumentException("royaltyBonus must be non-negative");
    }

    public HandRanking withRoyalty(int royalty) {
        return new HandRanking(handType, tiebreakKey, strengthValue, royalty, cards);
    }

    /** Rank of the pair, trips or quads, or the high card otherwise. */
    public Card.Rank primaryRank() {
        return tiebreakKey.isEmpty() ? null : tiebreakKey.get(0);
    }

    public boolean beats(HandRanking other) { return compareTo(other) > 0; }

    public boolean hasRoyalty() { return royaltyBonus > 0; }

    @Override
    public int compareTo(HandRanking o) {
        return Long.compare(strengthValue, o.strengthValue);
    }

    public String describe() {
        String ranks = tiebreakKey.stream().map(Card.Rank::getSymbol).collect(Collectors.joining(""));
        return handType.getDisplayName() + " [" + ranks + "]";
    }
}
