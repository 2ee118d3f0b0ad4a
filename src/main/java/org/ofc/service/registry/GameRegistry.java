package org.ofc.service.registry;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.ofc.exception.GameStateException;
import org.ofc.model.Deck;
import org.ofc.model.FantasyLandState;
import org.ofc.model.Game;
import org.ofc.model.GameRules;
import org.ofc.model.Player;
import org.ofc.service.engine.FantasyLandManager;
import org.ofc.service.engine.HandEvaluator;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/** In-memory home of the running games, keyed by game id. */
@Slf4j
@Service
@RequiredArgsConstructor
public class GameRegistry {
    private final HandEvaluator evaluator;
    private final FantasyLandManager fantasyLand;
    private final GameRules defaultRules;
    private final Clock clock;
    private final Map<String, Game> games = new ConcurrentHashMap<>();

    public Game create(List<String> playerIds) {
        return create(defaultRules, playerIds);
    }

    public Game create(GameRules rules, List<String> playerIds) {
        return create(rules, playerIds, new Deck());
    }

    /** Seats the players in the given order; player names default to their ids. */
    public Game create(GameRules rules, List<String> playerIds, Deck deck) {
        Map<String, String> names = new LinkedHashMap<>();
        for (String id : playerIds) names.put(id, id);
        if (names.size() != playerIds.size()) throw new GameStateException("All players must have unique ids");
        return register(rules, names, deck, Map.of());
    }

    /**
     * Deals the next hand to the same table. Fantasy Land history carries over, so players who
     * qualified start with the full Fantasy Land deal.
     */
    public Game createNextHand(String previousGameId) {
        return createNextHand(previousGameId, new Deck());
    }

    public Game createNextHand(String previousGameId, Deck deck) {
        Game previous = get(previousGameId);
        if (!previous.isCompleted())
            throw new GameStateException("Previous hand is not completed", previousGameId);
        Map<String, String> names = new LinkedHashMap<>();
        for (Player p : previous.getPlayers()) names.put(p.getId(), p.getName());
        return register(previous.getRules(), names, deck, previous.getFantasyLandStates());
    }

    private Game register(GameRules rules, Map<String, String> names, Deck deck, Map<String, FantasyLandState> prior) {
        String id = UUID.randomUUID().toString();
        List<Player> players = new ArrayList<>(names.size());
        names.forEach((pid, name) -> players.add(new Player(pid, name, rules, evaluator)));
        Game game = new Game(id, players, rules, deck, evaluator, fantasyLand, clock, prior);
        games.put(id, game);
        log.info("Created {} game {} for players {}", rules.getVariant(), id, names.keySet());
        return game;
    }

    public Collection<Game> all() { return games.values(); }

    public Game get(String id) {
        Game g = games.get(id);
        if (g == null) throw new GameStateException("Unknown game " + id, id);
        return g;
    }

    public Optional<Game> find(String id) { return Optional.ofNullable(games.get(id)); }

    public void remove(String id) {
        if (games.remove(id) != null) log.debug("Removed game {}", id);
    }
}
