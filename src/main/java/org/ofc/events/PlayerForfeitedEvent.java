package org.ofc.events;

import java.time.Instant;

public record PlayerForfeitedEvent(String gameId, String playerId, int remainingPlayers,
                                   Instant occurredAt) implements GameEvent {}
