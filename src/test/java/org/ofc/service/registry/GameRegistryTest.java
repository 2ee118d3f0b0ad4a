package org.ofc.service.registry;

import org.ofc.exception.GameStateException;
import org.ofc.model.*;
import org.ofc.service.engine.FantasyLandManager;
import org.ofc.service.engine.HandEvaluator;
import org.ofc.support.ScriptedHand;
import org.junit.jupiter.api.*;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

class GameRegistryTest {

    HandEvaluator evaluator = new HandEvaluator();
    GameRegistry registry;

    @BeforeEach
    void init() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);
        registry = new GameRegistry(evaluator, new FantasyLandManager(evaluator), GameRules.standard(), clock);
    }

    // --------------------------------------------------------------
    // create / get / remove
    // --------------------------------------------------------------
    @Test
    void create_registersGameWithDefaultRules() {
        Game g = registry.create(List.of("alice", "bob"));

        assertThat(registry.get(g.getId())).isSameAs(g);
        assertThat(g.getRules()).isEqualTo(GameRules.standard());
        assertThat(g.getPlayers()).extracting(Player::getId).containsExactly("alice", "bob");
        assertThat(registry.all()).containsExactly(g);
    }

    @Test
    void create_givesDistinctIds() {
        Game a = registry.create(List.of("a", "b"));
        Game b = registry.create(GameRules.pineapple(), List.of("a", "b", "c"));

        assertThat(a.getId()).isNotEqualTo(b.getId());
        assertThat(registry.all()).hasSize(2);
    }

    @Test
    void create_duplicatePlayers_rejected() {
        assertThatThrownBy(() -> registry.create(List.of("a", "a")))
                .isInstanceOf(GameStateException.class);
        assertThat(registry.all()).isEmpty();
    }

    @Test
    void get_unknown_throws() {
        assertThatThrownBy(() -> registry.get("nope"))
                .isInstanceOf(GameStateException.class)
                .hasMessageContaining("nope");
        assertThat(registry.find("nope")).isEmpty();
    }

    @Test
    void remove_forgetsGame() {
        Game g = registry.create(List.of("a", "b"));

        registry.remove(g.getId());

        assertThat(registry.find(g.getId())).isEmpty();
    }

    // --------------------------------------------------------------
    // createNextHand()
    // --------------------------------------------------------------
    @Test
    void createNextHand_requiresCompletedHand() {
        Game g = registry.create(List.of("a", "b"));

        assertThatThrownBy(() -> registry.createNextHand(g.getId()))
                .isInstanceOf(GameStateException.class)
                .hasMessageContaining("not completed");
    }

    @Test
    void createNextHand_carriesFantasyLandForward() {
        ScriptedHand hand = new ScriptedHand()
                .seat("p1", "Qh Qd 2c", "As Ad Ks Kd 3c", "9c 9d 9h 4c 4d")
                .seat("p2", "Ah Ac 5d", "7h 8c Jd 2d 3d", "6h 6c Tc Ts 2h");
        Game first = registry.create(GameRules.standard(), hand.playerIds(), hand.standardDeck());
        hand.playStandard(first);

        Game next = registry.createNextHand(first.getId(), new Deck(new Random(8)));

        Player p1 = next.getPlayer("p1").orElseThrow();
        assertThat(next.getId()).isNotEqualTo(first.getId());
        assertThat(p1.isInFantasyLand()).isTrue();
        assertThat(p1.getFantasyLandCards()).hasSize(13);
        assertThat(next.getPlayer("p2").orElseThrow().getHandCards()).hasSize(5);
        assertThat(next.getFantasyLandState("p1").consecutiveCount()).isEqualTo(1);
        assertThat(next.getRemainingCards()).hasSize(52 - 18);
    }
}
