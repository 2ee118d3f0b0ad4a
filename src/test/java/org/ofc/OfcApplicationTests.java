package org.ofc;

import org.ofc.dto.AnalysisPosition;
import org.ofc.model.Card;
import org.ofc.model.Game;
import org.ofc.model.GameRules;
import org.ofc.model.GameStatus;
import org.ofc.model.RoyaltySchedule;
import org.ofc.model.Variant;
import org.ofc.service.action.ActionService;
import org.ofc.service.engine.FantasyLandManager;
import org.ofc.service.engine.GameValidator;
import org.ofc.service.engine.HandEvaluator;
import org.ofc.service.registry.GameRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.stereotype.Service;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@SpringBootTest(properties = {"ofc.variant=pineapple", "ofc.fantasy-land.entry-rank=K"})
class OfcApplicationTests {

    @Autowired GameRules defaultRules;
    @Autowired GameRegistry registry;
    @Autowired ActionService actions;

    @Test
    void contextLoads_withConfiguredRules() {
        assertThat(defaultRules.getVariant()).isEqualTo(Variant.PINEAPPLE);
        assertThat(defaultRules.isPineapple()).isTrue();
        assertThat(defaultRules.getRoyalties()).isEqualTo(RoyaltySchedule.PINEAPPLE);
        assertThat(defaultRules.getFantasyLandEntryRank()).isEqualTo(Card.Rank.KING);
    }

    @Test
    void engineBeans_areServices() {
        assertThat(HandEvaluator.class).hasAnnotation(Service.class);
        assertThat(FantasyLandManager.class).hasAnnotation(Service.class);
        assertThat(GameValidator.class).hasAnnotation(Service.class);
    }

    @Test
    void createdGame_acceptsActions() {
        Game game = registry.create(List.of("p1", "p2", "p3"));
        assertThat(game.getRules()).isEqualTo(defaultRules);

        AnalysisPosition pos = actions.forfeit(game.getId(), "p3", 0L);

        assertThat(pos.status()).isEqualTo(GameStatus.IN_PROGRESS);
        assertThat(pos.version()).isEqualTo(1);
        assertThat(actions.currentPlayer(game.getId())).isEqualTo("p1");
        registry.remove(game.getId());
    }
}
