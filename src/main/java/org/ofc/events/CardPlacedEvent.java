package org.ofc.events;

import org.ofc.model.Card;
import org.ofc.model.Row;

import java.time.Instant;

public record CardPlacedEvent(String gameId, String playerId, Card card, Row row,
                              int roundNumber, long placementSequence, Instant occurredAt) implements GameEvent {}
