package org.ofc.service.engine;

import org.ofc.model.Card;
import org.ofc.model.HandRanking;
import org.ofc.model.HandType;
import org.ofc.model.Row;
import org.ofc.model.RoyaltySchedule;
import org.ofc.model.rules.RoyaltyRules;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Ranks 3- and 5-card rows and applies the royalty tables. Stateless and shared.
 *
 * <p>Strength values put the hand type above a base-16 encoding of the tiebreak key, so a 3-card
 * top row and a 5-card row can be compared directly: a top pair of aces with a king kicker beats a
 * middle pair of aces with a nine kicker.
 */
@Service
public class HandEvaluator {

    private static final long BASE = 16;
    private static final int KEY_LENGTH = 5;
    private static final long TYPE_WEIGHT = pow(BASE, KEY_LENGTH);

    /**
     * Ranks a 3- or 5-card set. The royalty is the classic one, as a top row for 3 cards and as a
     * bottom row for 5.
     *
     * @throws IllegalArgumentException for any other card count or for duplicate cards
     */
    public HandRanking evaluate(List<Card> cards) {
        HandRanking h = rank(cards);
        Row row = cards.size() == Row.TOP.getCapacity() ? Row.TOP : Row.BOTTOM;
        return h.withRoyalty(RoyaltyRules.royalty(RoyaltySchedule.CLASSIC, row, h));
    }

    /** Ranks a full row and fills in the royalty for that row under the given schedule. */
    public HandRanking evaluate(List<Card> cards, Row row, RoyaltySchedule schedule) {
        if (cards.size() != row.getCapacity())
            throw new IllegalArgumentException(row.getDisplayName() + " needs " + row.getCapacity() + " cards, got " + cards.size());
        HandRanking h = rank(cards);
        return h.withRoyalty(RoyaltyRules.royalty(schedule, row, h));
    }

    public int royaltyBonus(HandRanking ranking, Row row, RoyaltySchedule schedule) {
        return RoyaltyRules.royalty(schedule, row, ranking);
    }

    /** -1, 0 or 1. */
    public int compare(HandRanking a, HandRanking b) {
        return Integer.signum(Long.compare(a.strengthValue(), b.strengthValue()));
    }

    /** True iff the rows are full and bottom &gt; middle &gt; top strictly. */
    public boolean validateOfcProgression(List<Card> top, List<Card> middle, List<Card> bottom) {
        if (top.size() != Row.TOP.getCapacity()
                || middle.size() != Row.MIDDLE.getCapacity()
                || bottom.size() != Row.BOTTOM.getCapacity()) return false;
        HandRanking t = rank(top), m = rank(middle), b = rank(bottom);
        return compare(b, m) > 0 && compare(m, t) > 0;
    }

    /**
     * @throws IllegalArgumentException if a row is not full; fouling is only defined for complete layouts
     */
    public boolean isFouledHand(List<Card> top, List<Card> middle, List<Card> bottom) {
        if (top.size() != Row.TOP.getCapacity()
                || middle.size() != Row.MIDDLE.getCapacity()
                || bottom.size() != Row.BOTTOM.getCapacity())
            throw new IllegalArgumentException("Fouling is only defined for a complete 3/5/5 layout");
        return !validateOfcProgression(top, middle, bottom);
    }

    /**
     * Ranks 0 to 5 cards. Full 3- and 5-card sets are ranked normally; other sizes only by rank
     * multiplicity (no straights or flushes). Used for foul-risk estimates on unfinished rows.
     */
    public HandRanking evaluatePartial(List<Card> cards) {
        if (cards.size() == 3 || cards.size() == 5) return rank(cards);
        if (cards.size() > 5) throw new IllegalArgumentException("At most 5 cards, got " + cards.size());
        checkDistinct(cards);
        List<int[]> groups = groups(cards);
        if (groups.isEmpty()) return new HandRanking(HandType.HIGH_CARD, List.of(), 0, 0, cards);
        int top = groups.get(0)[1];
        HandType type;
        if (top == 4) type = HandType.QUADS;
        else if (top == 3) type = HandType.TRIPS;
        else if (top == 2 && groups.size() > 1 && groups.get(1)[1] == 2) type = HandType.TWO_PAIR;
        else if (top == 2) type = HandType.PAIR;
        else type = HandType.HIGH_CARD;
        return build(type, groupKey(groups), cards);
    }

    // ---------------------------------------------------------------------

    private HandRanking rank(List<Card> cards) {
        if (cards == null || (cards.size() != 3 && cards.size() != 5))
            throw new IllegalArgumentException("Hand must have 3 or 5 cards, got " + (cards == null ? 0 : cards.size()));
        checkDistinct(cards);

        List<int[]> groups = groups(cards);
        boolean five = cards.size() == 5;
        boolean flush = five && cards.stream().map(Card::getSuit).distinct().count() == 1;
        int straightHigh = five ? straightHigh(groups) : 0;
        boolean straight = straightHigh > 0;

        int c0 = groups.get(0)[1];
        int c1 = groups.size() > 1 ? groups.get(1)[1] : 0;

        if (straight && flush) return build(HandType.STRAIGHT_FLUSH, List.of(Card.Rank.ofValue(straightHigh)), cards);
        if (c0 == 4) return build(HandType.QUADS, groupKey(groups), cards);
        if (c0 == 3 && c1 == 2) return build(HandType.FULL_HOUSE, groupKey(groups), cards);
        if (flush) return build(HandType.FLUSH, groupKey(groups), cards);
        if (straight) return build(HandType.STRAIGHT, List.of(Card.Rank.ofValue(straightHigh)), cards);
        if (c0 == 3) return build(HandType.TRIPS, groupKey(groups), cards);
        if (c0 == 2 && c1 == 2) return build(HandType.TWO_PAIR, groupKey(groups), cards);
        if (c0 == 2) return build(HandType.PAIR, groupKey(groups), cards);
        return build(HandType.HIGH_CARD, groupKey(groups), cards);
    }

    private static void checkDistinct(List<Card> cards) {
        Set<Card> seen = new HashSet<>();
        for (Card c : cards) {
            if (c == null) throw new IllegalArgumentException("Null card in hand");
            if (!seen.add(c)) throw new IllegalArgumentException("Duplicate card in hand: " + c);
        }
    }

    /** {rankValue, count} pairs, most frequent first, then highest rank first. */
    private static List<int[]> groups(List<Card> cards) {
        int[] counts = new int[15];
        for (Card c : cards) counts[c.getRank().getValue()]++;
        List<int[]> out = new ArrayList<>();
        for (int r = 14; r >= 2; r--) if (counts[r] > 0) out.add(new int[]{r, counts[r]});
        out.sort((a, b) -> a[1] != b[1] ? Integer.compare(b[1], a[1]) : Integer.compare(b[0], a[0]));
        return out;
    }

    private static List<Card.Rank> groupKey(List<int[]> groups) {
        List<Card.Rank> key = new ArrayList<>(groups.size());
        for (int[] g : groups) key.add(Card.Rank.ofValue(g[0]));
        return key;
    }

    /** High card of a 5-card straight, 5 for the wheel, 0 if none. */
    private static int straightHigh(List<int[]> groups) {
        if (groups.size() != 5) return 0;
        int max = groups.get(0)[0], min = groups.get(4)[0];
        if (max - min == 4) return max;
        // A-2-3-4-5: ace plays low
        if (max == 14 && groups.get(1)[0] == 5 && min == 2) return 5;
        return 0;
    }

    private static HandRanking build(HandType type, List<Card.Rank> key, List<Card> cards) {
        return new HandRanking(type, key, strength(type, key), 0, cards);
    }

    static long strength(HandType type, List<Card.Rank> key) {
        long v = type.ordinal() * TYPE_WEIGHT;
        for (int i = 0; i < KEY_LENGTH && i < key.size(); i++) {
            v += key.get(i).getValue() * pow(BASE, KEY_LENGTH - 1 - i);
        }
        return v;
    }

    private static long pow(long b, int e) {
        long r = 1;
        for (int i = 0; i < e; i++) r *= b;
        return r;
    }
}
