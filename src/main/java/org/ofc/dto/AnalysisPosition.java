package org.ofc.dto;

import org.ofc.model.Card;
import org.ofc.model.GameRules;
import org.ofc.model.GameStatus;
import org.ofc.model.HandSnapshot;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Serializable snapshot of a game for analysis or display. {@code currentPlayerId} is null once the game is over. */
public record AnalysisPosition(String gameId,
                               long version,
                               GameStatus status,
                               Map<String, HandSnapshot> playersHands,
                               List<Card> remainingCards,
                               String currentPlayerId,
                               int roundNumber,
                               GameRules rules) {
    public AnalysisPosition {
        playersHands = Collections.unmodifiableMap(new LinkedHashMap<>(playersHands));
        remainingCards = List.copyOf(remainingCards);
    }
}
