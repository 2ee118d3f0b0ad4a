package org.ofc.dto;

import java.util.List;

/** The five initial cards of a player, each in its own slot. */
public record InitialPlacement(String playerId, List<Placement> placements) {
    public InitialPlacement {
        placements = placements == null ? List.of() : List.copyOf(placements);
    }
}
