package org.ofc.model;

import org.junit.jupiter.api.*;

import static org.assertj.core.api.Assertions.*;

class GameRulesTest {

    @Test
    void variantDefaults() {
        GameRules standard = GameRules.standard();
        GameRules pineapple = GameRules.pineapple();

        assertThat(standard.getMaxPlayers()).isEqualTo(4);
        assertThat(standard.getCardsPerTurn()).isEqualTo(1);
        assertThat(standard.getPointMultiplier()).isEqualTo(1);
        assertThat(standard.getRoyalties()).isEqualTo(RoyaltySchedule.CLASSIC);
        assertThat(standard.fantasyLandCardCount()).isEqualTo(13);

        assertThat(pineapple.isPineapple()).isTrue();
        assertThat(pineapple.getMaxPlayers()).isEqualTo(3);
        assertThat(pineapple.getCardsPerTurn()).isEqualTo(3);
        assertThat(pineapple.getPointMultiplier()).isEqualTo(2);
        assertThat(pineapple.getRoyalties()).isEqualTo(RoyaltySchedule.PINEAPPLE);
        assertThat(pineapple.fantasyLandCardCount()).isEqualTo(14);
    }

    @Test
    void builder_rejectsOutOfRangeBounds() {
        assertThatThrownBy(() -> GameRules.standard().toBuilder().maxPlayers(6).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> GameRules.standard().toBuilder().minPlayers(3).maxPlayers(2).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> GameRules.standard().toBuilder().initialCardsCount(0).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void builder_missingRoyaltiesFallBackToVariant() {
        GameRules rules = GameRules.pineapple().toBuilder().royalties(null).fantasyLandEntryRank(null).build();

        assertThat(rules.getRoyalties()).isEqualTo(RoyaltySchedule.PINEAPPLE);
        assertThat(rules.getFantasyLandEntryRank()).isEqualTo(Card.Rank.QUEEN);
    }
}
