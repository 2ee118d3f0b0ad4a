package org.ofc.model.rules;

import org.ofc.model.Deck;
import org.ofc.model.GameRules;
import org.ofc.model.Player;

import java.util.Collection;

public final class DealingRules {
    private DealingRules(){}

    /** Fantasy Land players get their whole hand, everybody else the initial five. */
    public static void dealInitial(Deck deck, Collection<Player> players, GameRules rules) {
        for (Player p : players) {
            if (p.isInFantasyLand()) {
                p.receiveFantasyLandCards(deck.deal(rules.fantasyLandCardCount()));
            } else {
                p.receiveInitialCards(deck.deal(rules.getInitialCardsCount()));
            }
        }
    }

    /** Deals the next street to every player who has run out of cards but still has empty slots. */
    public static void dealStreet(Deck deck, Collection<Player> players, GameRules rules) {
        for (Player p : players) {
            if (!needsStreet(p)) continue;
            if (rules.isPineapple()) {
                p.receiveStreetCards(deck.deal(rules.getCardsPerTurn()));
            } else {
                p.receiveCards(deck.deal(Math.min(rules.getCardsPerTurn(), p.openSlots())));
            }
        }
    }

    public static boolean needsStreet(Player p) {
        return p.isActiveInHand() && !p.isInFantasyLand() && p.getHandCards().isEmpty() && p.openSlots() > 0;
    }
}
