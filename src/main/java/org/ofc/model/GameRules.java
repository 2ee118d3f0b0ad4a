package org.ofc.model;

import lombok.Builder;
import lombok.Value;

/**
 * Rules configuration of one game. Start from {@link #standard()} or {@link #pineapple()} and
 * adjust with {@link #toBuilder()}.
 */
@Value
public class GameRules {
    public static final int MIN_PLAYERS = 2;
    public static final int MAX_PLAYERS = 4;

    Variant variant;
    int minPlayers;
    int maxPlayers;
    boolean fantasyLandEnabled;
    int initialCardsCount;
    int cardsPerTurn;
    RoyaltySchedule royalties;
    int pointMultiplier;
    int scoopBonus;
    Card.Rank fantasyLandEntryRank;
    boolean extendedFantasyLandStay;

    @Builder(toBuilder = true)
    private GameRules(Variant variant, int minPlayers, int maxPlayers, boolean fantasyLandEnabled,
                      int initialCardsCount, int cardsPerTurn, RoyaltySchedule royalties,
                      int pointMultiplier, int scoopBonus, Card.Rank fantasyLandEntryRank,
                      boolean extendedFantasyLandStay) {
        if (variant == null) throw new IllegalArgumentException("Variant is required");
        if (minPlayers < MIN_PLAYERS || maxPlayers > MAX_PLAYERS || minPlayers > maxPlayers)
            throw new IllegalArgumentException("Player bounds must lie within 2-4, got " + minPlayers + "-" + maxPlayers);
        if (initialCardsCount < 1 || initialCardsCount > Row.LAYOUT_SIZE)
            throw new IllegalArgumentException("Invalid initial card count: " + initialCardsCount);
        if (cardsPerTurn < 1) throw new IllegalArgumentException("Invalid cards per turn: " + cardsPerTurn);
        if (pointMultiplier < 1) throw new IllegalArgumentException("Point multiplier must be positive");
        if (scoopBonus < 0) throw new IllegalArgumentException("Scoop bonus cannot be negative");
        this.variant = variant;
        this.minPlayers = minPlayers;
        this.maxPlayers = maxPlayers;
        this.fantasyLandEnabled = fantasyLandEnabled;
        this.initialCardsCount = initialCardsCount;
        this.cardsPerTurn = cardsPerTurn;
        this.royalties = royalties != null ? royalties : variant.getRoyalties();
        this.pointMultiplier = pointMultiplier;
        this.scoopBonus = scoopBonus;
        this.fantasyLandEntryRank = fantasyLandEntryRank != null ? fantasyLandEntryRank : Card.Rank.QUEEN;
        this.extendedFantasyLandStay = extendedFantasyLandStay;
    }

    public static GameRules forVariant(Variant variant) {
        return GameRules.builder()
                .variant(variant)
                .minPlayers(MIN_PLAYERS)
                .maxPlayers(variant.getMaxPlayers())
                .fantasyLandEnabled(true)
                .initialCardsCount(variant.getInitialCards())
                .cardsPerTurn(variant.getCardsPerTurn())
                .royalties(variant.getRoyalties())
                .pointMultiplier(variant.getPointMultiplier())
                .scoopBonus(3)
                .fantasyLandEntryRank(Card.Rank.QUEEN)
                .extendedFantasyLandStay(true)
                .build();
    }

    public static GameRules standard() { return forVariant(Variant.STANDARD); }

    public static GameRules pineapple() { return forVariant(Variant.PINEAPPLE); }

    public boolean isPineapple() { return variant == Variant.PINEAPPLE; }

    public int fantasyLandCardCount() { return variant.getFantasyLandCards(); }
}
