package org.ofc.model;

public enum GameStatus {
    WAITING, IN_PROGRESS, PAUSED, COMPLETED, CANCELLED;

    public boolean isTerminal() { return this == COMPLETED || this == CANCELLED; }
}
