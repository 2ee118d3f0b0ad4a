package org.ofc.model;

/**
 * Fantasy Land history of one player. Transitions return new instances; a state is kept for the
 * whole session so the streak survives from hand to hand.
 *
 * @param playerId         owner
 * @param active           whether the player is in Fantasy Land for the next hand
 * @param entryRound       round at which the current streak started, {@code null} when inactive
 * @param consecutiveCount length of the current streak
 */
public record FantasyLandState(String playerId, boolean active, Integer entryRound, int consecutiveCount) {

    public static FantasyLandState createInitial(String playerId) {
        return new FantasyLandState(playerId, false, null, 0);
    }

    public FantasyLandState enter(int round) {
        if (active) return new FantasyLandState(playerId, true, entryRound, consecutiveCount + 1);
        return new FantasyLandState(playerId, true, round, 1);
    }

    public FantasyLandState exit() {
        return new FantasyLandState(playerId, false, null, 0);
    }
}
