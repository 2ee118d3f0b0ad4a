package org.ofc.service.action;

import org.ofc.dto.AnalysisPosition;
import org.ofc.dto.PineappleAction;
import org.ofc.dto.Placement;
import org.ofc.events.CardPlacedEvent;
import org.ofc.events.GameCompletedEvent;
import org.ofc.events.PlayerForfeitedEvent;
import org.ofc.events.RoundStartedEvent;
import org.ofc.exception.GameStateException;
import org.ofc.exception.InvalidCardPlacementException;
import org.ofc.model.*;
import org.ofc.service.engine.FantasyLandManager;
import org.ofc.service.engine.GameValidator;
import org.ofc.service.engine.HandEvaluator;
import org.ofc.service.registry.GameRegistry;
import org.ofc.service.util.Locks;
import org.ofc.support.ScriptedHand;
import org.junit.jupiter.api.*;
import org.mockito.*;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

class ActionServiceTest {

    @Mock ApplicationEventPublisher publisher;

    ActionService service;
    GameRegistry registry;

    ScriptedHand hand = new ScriptedHand()
            .seat("p1", "Qh Qd 2c", "As Ad Ks Kd 3c", "9c 9d 9h 4c 4d")
            .seat("p2", "Ah Ac 5d", "7h 8c Jd 2d 3d", "6h 6c Tc Ts 2h");

    @BeforeEach
    void setup() {
        MockitoAnnotations.openMocks(this);
        HandEvaluator evaluator = new HandEvaluator();
        FantasyLandManager fantasyLand = new FantasyLandManager(evaluator);
        registry = new GameRegistry(evaluator, fantasyLand, GameRules.standard(), Clock.systemUTC());
        service = new ActionService(registry, new GameValidator(evaluator, fantasyLand), new Locks(8), publisher);
    }

    private String newGame() {
        return registry.create(GameRules.standard(), hand.playerIds(), hand.standardDeck()).getId();
    }

    // --------------------------------------------------------------
    // placeCard()
    // --------------------------------------------------------------
    @Test
    void placeCard_appliesAndPublishesAfterwards() {
        String id = newGame();

        AnalysisPosition pos = service.placeCard(id, "p1", Card.parse("Qh"), Row.TOP);

        assertThat(pos.version()).isEqualTo(1);
        assertThat(pos.currentPlayerId()).isEqualTo("p2");
        assertThat(pos.playersHands().get("p1").top()).containsExactly(Card.parse("Qh"));

        ArgumentCaptor<Object> events = ArgumentCaptor.forClass(Object.class);
        verify(publisher, times(2)).publishEvent(events.capture());
        assertThat(events.getAllValues().get(0)).isInstanceOf(RoundStartedEvent.class);
        assertThat(events.getAllValues().get(1)).isInstanceOfSatisfying(CardPlacedEvent.class, e -> {
            assertThat(e.playerId()).isEqualTo("p1");
            assertThat(e.placementSequence()).isEqualTo(1);
        });
    }

    @Test
    void placeCard_wrongTurn_rejectedWithoutEvents() {
        String id = newGame();

        assertThatThrownBy(() -> service.placeCard(id, "p2", Card.parse("Ah"), Row.TOP))
                .isInstanceOf(GameStateException.class)
                .hasMessageContaining("turn");
        verifyNoInteractions(publisher);
    }

    @Test
    void placeCard_cardNotHeld_rejected() {
        String id = newGame();

        assertThatThrownBy(() -> service.placeCard(id, "p1", Card.parse("Ah"), Row.TOP))
                .isInstanceOf(InvalidCardPlacementException.class)
                .hasMessage("Player p1 does not have card Ah");
    }

    @Test
    void placeCard_staleVersion_rejected() {
        String id = newGame();
        service.placeCard(id, "p1", Card.parse("Qh"), Row.TOP, 0L);

        assertThatThrownBy(() -> service.placeCard(id, "p2", Card.parse("Ah"), Row.TOP, 0L))
                .isInstanceOf(GameStateException.class)
                .hasMessageContaining("Stale");
        assertThat(service.analysisPosition(id).version()).isEqualTo(1);
    }

    @Test
    void unknownGame_rejected() {
        assertThatThrownBy(() -> service.placeCard("missing", "p1", Card.parse("Qh"), Row.TOP))
                .isInstanceOf(GameStateException.class);
    }

    // --------------------------------------------------------------
    // multi-card actions
    // --------------------------------------------------------------
    @Test
    void fullHand_publishesCompletionOnce() {
        String id = newGame();

        for (String p : hand.playerIds()) service.applyInitialPlacement(id, hand.initial(p), null);
        for (int s = 0; s < 8; s++) {
            for (String p : hand.playerIds()) {
                Placement pl = hand.street(p, s);
                service.placeCard(id, p, pl.card(), pl.row());
            }
        }

        verify(publisher, times(1)).publishEvent(any(GameCompletedEvent.class));
        AnalysisPosition pos = service.analysisPosition(id);
        assertThat(pos.status()).isEqualTo(GameStatus.COMPLETED);
        assertThat(pos.currentPlayerId()).isNull();
        assertThatThrownBy(() -> service.currentPlayer(id)).isInstanceOf(GameStateException.class);
    }

    @Test
    void applyPineappleAction_invalidDiscard_reportsValidatorMessage() {
        ScriptedHand pine = new ScriptedHand()
                .seat("p1", "2c 3d 4c", "Js Jd 6d 7c 8c", "Ks Kd Qd Qh 9c", "Ad As Ac 9d")
                .seat("p2", "5c 5d 5h", "6c 7d 8h 9s Tc", "Ah Kh Jh 3h 2h", "Qs Qc Th Td");
        String id = registry.create(GameRules.pineapple(), pine.playerIds(), pine.pineappleDeck()).getId();
        service.applyInitialPlacement(id, pine.initial("p1"), null);
        service.applyInitialPlacement(id, pine.initial("p2"), null);
        PineappleAction good = pine.pineappleStreet("p1", 0);

        assertThatThrownBy(() -> service.applyPineappleAction(id,
                new PineappleAction("p1", good.dealtCards(), good.placements(), Card.parse("2s")), null))
                .isInstanceOf(InvalidCardPlacementException.class)
                .hasMessage("Placed and discarded cards must match dealt cards");

        AnalysisPosition pos = service.applyPineappleAction(id, good, null);
        assertThat(pos.playersHands().get("p1").middle()).hasSize(4);
        assertThat(pos.currentPlayerId()).isEqualTo("p2");
    }

    // --------------------------------------------------------------
    // lifecycle / reads
    // --------------------------------------------------------------
    @Test
    void pauseResumeCancel() {
        String id = newGame();

        assertThat(service.pause(id).status()).isEqualTo(GameStatus.PAUSED);
        assertThatThrownBy(() -> service.placeCard(id, "p1", Card.parse("Qh"), Row.TOP))
                .isInstanceOf(GameStateException.class)
                .hasMessage("Game is PAUSED");
        assertThatThrownBy(() -> service.applyInitialPlacement(id, hand.initial("p1"), null))
                .isInstanceOf(GameStateException.class);
        assertThat(service.resume(id).status()).isEqualTo(GameStatus.IN_PROGRESS);
        assertThat(service.cancel(id).status()).isEqualTo(GameStatus.CANCELLED);
    }

    @Test
    void forfeit_publishesEvent() {
        String id = newGame();

        AnalysisPosition pos = service.forfeit(id, "p2", null);

        assertThat(pos.currentPlayerId()).isEqualTo("p1");
        verify(publisher).publishEvent(any(PlayerForfeitedEvent.class));
    }

    @Test
    void validationSummary_andCurrentPlayer() {
        String id = newGame();

        Map<String, ValidationResult> summary = service.validationSummary(id);

        assertThat(summary).containsKeys("game_state", "turn_order");
        assertThat(service.currentPlayer(id)).isEqualTo("p1");
    }

    @Test
    void startNextHand_dealsFantasyLandHand() {
        String id = newGame();
        Game game = registry.get(id);
        hand.playStandard(game);

        AnalysisPosition next = service.startNextHand(id);

        assertThat(next.gameId()).isNotEqualTo(id);
        assertThat(next.playersHands().get("p1").handCards()).hasSize(13);
        assertThat(next.playersHands().get("p2").handCards()).hasSize(5);
        assertThat(registry.all()).hasSize(2);
    }

    @Test
    void reads_takeGameSnapshots() {
        String id = newGame();
        AnalysisPosition before = service.analysisPosition(id);

        service.placeCard(id, "p1", Card.parse("Qh"), Row.TOP);

        assertThat(before.playersHands().get("p1").top()).isEmpty();
        assertThat(service.analysisPosition(id).playersHands().get("p1").top()).hasSize(1);
        assertThat(before.version()).isZero();
    }
}
