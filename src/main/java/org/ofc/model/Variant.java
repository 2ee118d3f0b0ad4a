package org.ofc.model;

import lombok.Getter;

@Getter
public enum Variant {
    // initial, per turn, max players, fantasy land cards, point multiplier, royalties
    STANDARD(5, 1, 4, 13, 1, RoyaltySchedule.CLASSIC),
    PINEAPPLE(5, 3, 3, 14, 2, RoyaltySchedule.PINEAPPLE);

    private final int initialCards;
    private final int cardsPerTurn;
    private final int maxPlayers;
    private final int fantasyLandCards;
    private final int pointMultiplier;
    private final RoyaltySchedule royalties;

    Variant(int initialCards, int cardsPerTurn, int maxPlayers, int fantasyLandCards,
            int pointMultiplier, RoyaltySchedule royalties) {
        this.initialCards = initialCards;
        this.cardsPerTurn = cardsPerTurn;
        this.maxPlayers = maxPlayers;
        this.fantasyLandCards = fantasyLandCards;
        this.pointMultiplier = pointMultiplier;
        this.royalties = royalties;
    }

    public static Variant parse(String s) {
        if (s == null) throw new IllegalArgumentException("Variant is required");
        String v = s.trim().replace('-', '_');
        for (Variant x : values()) {
            if (x.name().equalsIgnoreCase(v)) return x;
        }
        throw new IllegalArgumentException("Invalid variant: " + s);
    }
}
