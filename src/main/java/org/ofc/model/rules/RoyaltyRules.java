package org.ofc.model.rules;

import org.ofc.model.Card;
import org.ofc.model.HandRanking;
import org.ofc.model.HandType;
import org.ofc.model.Row;
import org.ofc.model.RoyaltySchedule;

import java.util.EnumMap;
import java.util.Map;

public final class RoyaltyRules {
    private RoyaltyRules(){}

    private static final Map<HandType, Integer> FIVE_CARD = new EnumMap<>(Map.of(
            HandType.STRAIGHT, 2,
            HandType.FLUSH, 4,
            HandType.FULL_HOUSE, 6,
            HandType.QUADS, 10,
            HandType.STRAIGHT_FLUSH, 15));
    private static final int ROYAL_FLUSH = 25;

    private static final Map<HandType, Integer> PINEAPPLE_MIDDLE = new EnumMap<>(Map.of(
            HandType.TRIPS, 2,
            HandType.STRAIGHT, 4,
            HandType.FLUSH, 8,
            HandType.FULL_HOUSE, 12,
            HandType.QUADS, 20,
            HandType.STRAIGHT_FLUSH, 30));
    private static final int PINEAPPLE_MIDDLE_ROYAL = 50;

    /** Lowest top pair paying a royalty. */
    public static final Card.Rank TOP_PAIR_THRESHOLD = Card.Rank.SIX;

    public static int royalty(RoyaltySchedule schedule, Row row, HandRanking hand) {
        return switch (row) {
            case TOP -> top(schedule, hand);
            case MIDDLE -> schedule == RoyaltySchedule.PINEAPPLE
                    ? fiveCard(PINEAPPLE_MIDDLE, PINEAPPLE_MIDDLE_ROYAL, hand)
                    : fiveCard(FIVE_CARD, ROYAL_FLUSH, hand);
            case BOTTOM -> fiveCard(FIVE_CARD, ROYAL_FLUSH, hand);
        };
    }

    /** Weakest hand type that pays anything in the given row. */
    public static HandType minimumQualifying(RoyaltySchedule schedule, Row row) {
        return switch (row) {
            case TOP -> HandType.PAIR;
            case MIDDLE -> schedule == RoyaltySchedule.PINEAPPLE ? HandType.TRIPS : HandType.STRAIGHT;
            case BOTTOM -> HandType.STRAIGHT;
        };
    }

    private static int top(RoyaltySchedule schedule, HandRanking hand) {
        if (hand.cards().size() != Row.TOP.getCapacity()) return 0;
        int r = hand.primaryRank().getValue();
        if (hand.handType() == HandType.TRIPS) {
            // 222 = 10 ... AAA = 22
            return schedule == RoyaltySchedule.PINEAPPLE ? 10 + (r - 2) : 10;
        }
        if (hand.handType() == HandType.PAIR && r >= TOP_PAIR_THRESHOLD.getValue()) {
            // 66 = 1 ... AA = 9
            return r - 5;
        }
        return 0;
    }

    private static int fiveCard(Map<HandType, Integer> table, int royal, HandRanking hand) {
        if (hand.cards().size() != Row.MIDDLE.getCapacity()) return 0;
        if (hand.handType() == HandType.STRAIGHT_FLUSH && hand.primaryRank() == Card.Rank.ACE) return royal;
        return table.getOrDefault(hand.handType(), 0);
    }
}
