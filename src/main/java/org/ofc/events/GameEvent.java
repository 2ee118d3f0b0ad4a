package org.ofc.events;

import java.time.Instant;

/** A fact emitted by a game; published once the game lock is released. */
public interface GameEvent {
    String gameId();

    Instant occurredAt();
}
