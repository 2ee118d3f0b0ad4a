package org.ofc.service.action;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.ofc.dto.AnalysisPosition;
import org.ofc.dto.FantasyLandPlacement;
import org.ofc.dto.InitialPlacement;
import org.ofc.dto.PineappleAction;
import org.ofc.events.GameCompletedEvent;
import org.ofc.events.GameEvent;
import org.ofc.exception.GameStateException;
import org.ofc.exception.InvalidCardPlacementException;
import org.ofc.model.Card;
import org.ofc.model.Game;
import org.ofc.model.GameStatus;
import org.ofc.model.Row;
import org.ofc.model.ValidationResult;
import org.ofc.service.engine.GameValidator;
import org.ofc.service.registry.GameRegistry;
import org.ofc.service.util.Locks;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Entry point for player actions. Each call validates and mutates one game under that game's
 * lock, then publishes the events the game recorded once the lock is released.
 *
 * <p>Every mutation accepts an optional expected version; a mismatch rejects the action before
 * anything is validated.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ActionService {
    private final GameRegistry registry;
    private final GameValidator validator;
    private final Locks locks;
    private final ApplicationEventPublisher publisher;

    public AnalysisPosition placeCard(String gameId, String playerId, Card card, Row row) {
        return placeCard(gameId, playerId, card, row, null);
    }

    public AnalysisPosition placeCard(String gameId, String playerId, Card card, Row row, Long expectedVersion) {
        return apply(gameId, expectedVersion, game -> {
            requireTurn(game, playerId);
            ValidationResult r = validator.validateCardPlacement(game, playerId, card, row);
            if (!r.valid()) {
                log.debug("Rejected {} to {} in game {}: {}", card, row, gameId, r.errorMessage());
                throw new InvalidCardPlacementException(r.errorMessage(), card, row);
            }
            game.placeCard(playerId, card, row);
        });
    }

    public AnalysisPosition applyInitialPlacement(String gameId, InitialPlacement placement, Long expectedVersion) {
        return apply(gameId, expectedVersion, game -> {
            requireTurn(game, placement.playerId());
            reject(validator.validateInitialPlacement(placement, game));
            game.applyInitialPlacement(placement);
        });
    }

    public AnalysisPosition applyPineappleAction(String gameId, PineappleAction action, Long expectedVersion) {
        return apply(gameId, expectedVersion, game -> {
            requireTurn(game, action.playerId());
            reject(validator.validatePineappleAction(action, game));
            game.applyPineappleAction(action);
        });
    }

    public AnalysisPosition applyFantasyLandPlacement(String gameId, FantasyLandPlacement placement, Long expectedVersion) {
        return apply(gameId, expectedVersion, game -> {
            requireTurn(game, placement.playerId());
            reject(validator.validateFantasyLandPlacement(placement, game));
            game.applyFantasyLandPlacement(placement);
        });
    }

    public AnalysisPosition forfeit(String gameId, String playerId, Long expectedVersion) {
        return apply(gameId, expectedVersion, game -> game.forfeit(playerId));
    }

    public AnalysisPosition pause(String gameId) { return apply(gameId, null, Game::pause); }

    public AnalysisPosition resume(String gameId) { return apply(gameId, null, Game::resume); }

    public AnalysisPosition cancel(String gameId) {
        AnalysisPosition pos = apply(gameId, null, Game::cancel);
        log.info("Game {} cancelled", gameId);
        return pos;
    }

    /** Deals the following hand to the players of a completed game. */
    public AnalysisPosition startNextHand(String previousGameId) {
        Game next;
        synchronized (locks.of(previousGameId)) {
            next = registry.createNextHand(previousGameId);
        }
        return apply(next.getId(), null, g -> { });
    }

    // ---------------------------------------------------------------- reads

    public AnalysisPosition analysisPosition(String gameId) {
        Game game = registry.get(gameId);
        synchronized (locks.of(gameId)) {
            return game.getAnalysisPosition();
        }
    }

    public Map<String, ValidationResult> validationSummary(String gameId) {
        Game game = registry.get(gameId);
        synchronized (locks.of(gameId)) {
            return validator.getValidationSummary(game);
        }
    }

    public String currentPlayer(String gameId) {
        Game game = registry.get(gameId);
        synchronized (locks.of(gameId)) {
            return game.getCurrentPlayer().getId();
        }
    }

    // ---------------------------------------------------------------- internals

    private AnalysisPosition apply(String gameId, Long expectedVersion, Consumer<Game> action) {
        Game game = registry.get(gameId);
        AnalysisPosition after;
        List<GameEvent> events;
        synchronized (locks.of(gameId)) {
            if (expectedVersion != null && expectedVersion != game.getVersion())
                throw new GameStateException("Stale game version " + expectedVersion + ", current is " + game.getVersion(), gameId);
            action.accept(game);
            after = game.getAnalysisPosition();
            events = game.pullEvents();
        }
        for (GameEvent e : events) {
            log.debug("Publishing {} for game {}", e.getClass().getSimpleName(), gameId);
            publisher.publishEvent(e);
        }
        if (events.stream().anyMatch(e -> e instanceof GameCompletedEvent))
            log.info("Game {} completed, winner {}", gameId, game.getWinnerId());
        return after;
    }

    private void requireTurn(Game game, String playerId) {
        if (game.getStatus() == GameStatus.PAUSED || game.getStatus() == GameStatus.WAITING) {
            log.debug("Action on {} game {}", game.getStatus(), game.getId());
            throw new GameStateException("Game is " + game.getStatus(), game.getId());
        }
        ValidationResult turn = validator.validateTurnOrder(game, playerId);
        if (!turn.valid()) {
            log.debug("Out of turn action in game {}: {}", game.getId(), turn.errorMessage());
            throw new GameStateException(turn.errorMessage(), game.getId());
        }
    }

    private void reject(ValidationResult r) {
        if (r.valid()) return;
        log.debug("Rejected action: {}", r.errorMessage());
        throw new InvalidCardPlacementException(r.errorMessage());
    }
}
