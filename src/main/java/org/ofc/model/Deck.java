package org.ofc.model;

import org.ofc.exception.GameStateException;

import java.security.SecureRandom;
import java.util.*;

/** A single 52-card deck; cards leave it only by being dealt. */
public class Deck {
    private final Deque<Card> cards = new ArrayDeque<>();

    public Deck() {
        this(new SecureRandom());
    }

    public Deck(Random rnd) {
        List<Card> tmp = Card.fullDeck();
        Collections.shuffle(tmp, rnd);
        cards.addAll(tmp);
    }

    private Deck(List<Card> ordered) {
        cards.addAll(ordered);
    }

    /** Deck dealing {@code first} in order, then the remaining cards in {@link Card#fullDeck()} order. */
    public static Deck stacked(List<Card> first) {
        Set<Card> seen = new LinkedHashSet<>(first);
        if (seen.size() != first.size()) throw new IllegalArgumentException("Stacked cards contain duplicates");
        List<Card> ordered = new ArrayList<>(first);
        for (Card c : Card.fullDeck()) if (!seen.contains(c)) ordered.add(c);
        return new Deck(ordered);
    }

    public Card draw() {
        Card c = cards.pollFirst();
        if (c == null) throw new GameStateException("Deck is empty");
        return c;
    }

    public List<Card> deal(int count) {
        if (count < 0) throw new IllegalArgumentException("Negative deal count");
        if (count > cards.size())
            throw new GameStateException("Deck has " + cards.size() + " cards, cannot deal " + count);
        List<Card> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) out.add(cards.pollFirst());
        return out;
    }

    public boolean contains(Card c) { return cards.contains(c); }

    public int size() { return cards.size(); }

    public List<Card> remainingCards() { return List.copyOf(cards); }
}
