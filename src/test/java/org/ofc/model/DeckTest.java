package org.ofc.model;

import org.ofc.exception.GameStateException;
import org.junit.jupiter.api.*;

import java.util.HashSet;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

class DeckTest {

    @Test
    void shuffledDeck_isAPermutationOfFullDeck() {
        Deck deck = new Deck(new Random(42));

        List<Card> dealt = deck.deal(52);

        assertThat(new HashSet<>(dealt)).containsExactlyInAnyOrderElementsOf(Card.fullDeck());
        assertThat(deck.size()).isZero();
    }

    @Test
    void stacked_dealsGivenCardsFirst() {
        Deck deck = Deck.stacked(Card.parseAll("Ah", "Kd"));

        assertThat(deck.size()).isEqualTo(52);
        assertThat(deck.draw()).isEqualTo(Card.parse("Ah"));
        assertThat(deck.draw()).isEqualTo(Card.parse("Kd"));
        assertThat(deck.contains(Card.parse("Ah"))).isFalse();
        assertThat(deck.draw()).isEqualTo(Card.parse("2s"));
    }

    @Test
    void stacked_rejectsDuplicates() {
        assertThatThrownBy(() -> Deck.stacked(Card.parseAll("Ah", "Ah")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void deal_moreThanRemaining_throws() {
        Deck deck = new Deck(new Random(1));
        deck.deal(50);

        assertThatThrownBy(() -> deck.deal(3))
                .isInstanceOf(GameStateException.class)
                .hasMessageContaining("cannot deal 3");
        assertThat(deck.size()).isEqualTo(2);
    }
}
