package org.ofc.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One of the 52 playing cards. Instances are shared constants obtained through {@link #of} or
 * {@link #parse}, so reference equality and value equality coincide.
 */
@Getter
public final class Card {
    private static final Card[] DECK = new Card[52];
    static {
        for (Suit s : Suit.values())
            for (Rank r : Rank.values()) DECK[s.ordinal() * 13 + r.ordinal()] = new Card(r, s);
    }

    private final Rank rank;
    private final Suit suit;

    private Card(Rank rank, Suit suit) {
        this.rank = rank;
        this.suit = suit;
    }

    public static Card of(Rank rank, Suit suit) {
        if (rank == null || suit == null) throw new IllegalArgumentException("Rank and suit are required");
        return DECK[suit.ordinal() * 13 + rank.ordinal()];
    }

    /** Parses codes such as {@code "Ah"}, {@code "Tc"}, {@code "10d"} or {@code "Q♠"}. */
    @JsonCreator
    public static Card parse(String code) {
        if (code == null || code.isBlank()) throw new IllegalArgumentException("Empty card code");
        String c = code.trim();
        if (c.length() < 2) throw new IllegalArgumentException("Invalid card code: " + code);
        String rankPart = c.substring(0, c.length() - 1);
        char suitPart = c.charAt(c.length() - 1);
        return of(Rank.parse(rankPart), Suit.parse(suitPart));
    }

    /** The 52 cards in suit-major order, spades first. */
    public static List<Card> fullDeck() {
        List<Card> all = new ArrayList<>(52);
        Collections.addAll(all, DECK);
        return all;
    }

    public static List<Card> parseAll(String... codes) {
        List<Card> out = new ArrayList<>(codes.length);
        for (String code : codes) out.add(parse(code));
        return out;
    }

    @JsonValue
    public String code() {
        return rank.getSymbol() + suit.getLetter();
    }

    @Override
    public String toString() {
        return code();
    }

    @Getter
    public enum Suit {
        SPADES('s', "♠"), HEARTS('h', "♥"), DIAMONDS('d', "♦"), CLUBS('c', "♣");

        private final char letter;
        private final String symbol;

        Suit(char letter, String symbol) {
            this.letter = letter;
            this.symbol = symbol;
        }

        public static Suit parse(char c) {
            for (Suit s : values()) {
                if (Character.toLowerCase(c) == s.letter || s.symbol.charAt(0) == c) return s;
            }
            throw new IllegalArgumentException("Unknown suit: " + c);
        }
    }

    @Getter
    public enum Rank {
        TWO(2, "2"), THREE(3, "3"), FOUR(4, "4"), FIVE(5, "5"), SIX(6, "6"), SEVEN(7, "7"),
        EIGHT(8, "8"), NINE(9, "9"), TEN(10, "T"), JACK(11, "J"), QUEEN(12, "Q"), KING(13, "K"), ACE(14, "A");

        private final int value;
        private final String symbol;

        Rank(int value, String symbol) {
            this.value = value;
            this.symbol = symbol;
        }

        public static Rank ofValue(int value) {
            if (value < 2 || value > 14) throw new IllegalArgumentException("Rank value out of range: " + value);
            return values()[value - 2];
        }

        public static Rank parse(String s) {
            if ("10".equals(s)) return TEN;
            for (Rank r : values()) {
                if (r.symbol.equalsIgnoreCase(s)) return r;
            }
            throw new IllegalArgumentException("Unknown rank: " + s);
        }
    }
}
