package org.ofc.events;

import java.time.Instant;

public record RoundStartedEvent(String gameId, int roundNumber, String activePlayerId,
                                int remainingCards, Instant occurredAt) implements GameEvent {}
