package org.ofc.dto;

import org.ofc.model.Card;

import java.util.List;

/**
 * A Pineapple street: three dealt cards, two placed and one discarded. Counts are not enforced here
 * so that a malformed action can still be reported by the validator.
 */
public record PineappleAction(String playerId, List<Card> dealtCards, List<Placement> placements, Card discardedCard) {
    public PineappleAction {
        dealtCards = dealtCards == null ? List.of() : List.copyOf(dealtCards);
        placements = placements == null ? List.of() : List.copyOf(placements);
    }

    public List<Card> placedCards() {
        return placements.stream().map(Placement::card).toList();
    }
}
