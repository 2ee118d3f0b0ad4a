package org.ofc.exception;

/** The operation is not allowed in the current game state (wrong turn, finished game, bad deal...). */
public class GameStateException extends IllegalStateException {
    private final String gameId;

    public GameStateException(String message) {
        this(message, null);
    }

    public GameStateException(String message, String gameId) {
        super(message);
        this.gameId = gameId;
    }

    public String getGameId() { return gameId; }
}
