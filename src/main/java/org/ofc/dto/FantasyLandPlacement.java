package org.ofc.dto;

import java.util.List;

/** A Fantasy Land hand set at once: thirteen placements, the rest of the dealt cards are discarded. */
public record FantasyLandPlacement(String playerId, List<Placement> placements) {
    public FantasyLandPlacement {
        placements = placements == null ? List.of() : List.copyOf(placements);
    }
}
