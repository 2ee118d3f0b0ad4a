package org.ofc.events;

import org.ofc.model.Score;

import java.time.Instant;
import java.util.Map;

public record GameCompletedEvent(String gameId, Map<String, Score> finalScores, String winnerId,
                                 long durationSeconds, Instant occurredAt) implements GameEvent {}
