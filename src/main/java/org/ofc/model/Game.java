package org.ofc.model;

import lombok.Getter;
import org.ofc.dto.AnalysisPosition;
import org.ofc.dto.FantasyLandPlacement;
import org.ofc.dto.InitialPlacement;
import org.ofc.dto.PineappleAction;
import org.ofc.dto.Placement;
import org.ofc.events.CardPlacedEvent;
import org.ofc.events.GameCompletedEvent;
import org.ofc.events.GameEvent;
import org.ofc.events.PlayerForfeitedEvent;
import org.ofc.events.RoundStartedEvent;
import org.ofc.exception.GameStateException;
import org.ofc.exception.InvalidCardPlacementException;
import org.ofc.model.rules.DealingRules;
import org.ofc.model.rules.ScoringRules;
import org.ofc.service.engine.FantasyLandManager;
import org.ofc.service.engine.HandEvaluator;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * One hand of OFC: the deck, the seated players, turn order, rounds and final scoring.
 *
 * <p>Not thread-safe. Callers serialize mutations per game (see
 * {@link org.ofc.service.action.ActionService}); {@link #getVersion()} increases on every successful
 * mutation so readers can detect stale snapshots.
 *
 * <p>At every point deck + hands + Fantasy Land pools + rows + discards hold the 52 cards exactly once.
 */
public class Game {
    @Getter private final String id;
    private final Map<String, Player> players = new LinkedHashMap<>();
    private final List<String> seats;
    @Getter private final GameRules rules;
    private final Deck deck;
    private final HandEvaluator evaluator;
    private final FantasyLandManager fantasyLand;
    private final Clock clock;

    private final List<Card> discards = new ArrayList<>();
    private final Map<String, FantasyLandState> fantasyLandStates = new LinkedHashMap<>();
    private final List<GameEvent> pendingEvents = new ArrayList<>();

    @Getter private GameStatus status = GameStatus.WAITING;
    @Getter private int currentRound = 0;
    @Getter private int turnIndex = 0;
    @Getter private long version = 0;
    private long placementSequence = 0;
    @Getter private final Instant createdAt;
    @Getter private Instant completedAt;
    private Map<String, Score> finalScores = Map.of();
    @Getter private String winnerId;

    public Game(String id, List<Player> players, GameRules rules, Deck deck,
                HandEvaluator evaluator, FantasyLandManager fantasyLand, Clock clock) {
        this(id, players, rules, deck, evaluator, fantasyLand, clock, Map.of());
    }

    /**
     * @param priorStates Fantasy Land history carried over from the previous hand; players whose
     *                    state is active start this hand in Fantasy Land
     * @throws GameStateException if the player count is outside 2-4 or the rules' bounds, or ids repeat
     */
    public Game(String id, List<Player> players, GameRules rules, Deck deck,
                HandEvaluator evaluator, FantasyLandManager fantasyLand, Clock clock,
                Map<String, FantasyLandState> priorStates) {
        if (players == null || players.size() < GameRules.MIN_PLAYERS || players.size() > GameRules.MAX_PLAYERS)
            throw new GameStateException("OFC games require 2-4 players", id);
        if (players.size() < rules.getMinPlayers() || players.size() > rules.getMaxPlayers())
            throw new GameStateException(rules.getVariant() + " games allow " + rules.getMinPlayers() + "-"
                    + rules.getMaxPlayers() + " players, got " + players.size(), id);
        for (Player p : players) {
            if (this.players.putIfAbsent(p.getId(), p) != null)
                throw new GameStateException("All players must have unique ids", id);
        }
        if (deck.size() != 52) throw new IllegalArgumentException("A game needs a full deck, got " + deck.size() + " cards");

        this.id = id;
        this.seats = List.copyOf(this.players.keySet());
        this.rules = rules;
        this.deck = deck;
        this.evaluator = evaluator;
        this.fantasyLand = fantasyLand;
        this.clock = clock;
        this.createdAt = clock.instant();

        for (Player p : players) {
            FantasyLandState st = priorStates.getOrDefault(p.getId(), FantasyLandState.createInitial(p.getId()));
            if (!rules.isFantasyLandEnabled()) {
                if (p.isInFantasyLand()) p.exitFantasyLand();
            } else if (st.active() && !p.isInFantasyLand()) {
                p.enterFantasyLand();
            } else if (p.isInFantasyLand() && !st.active()) {
                st = st.enter(0);
            }
            fantasyLandStates.put(p.getId(), st);
        }

        DealingRules.dealInitial(deck, players, rules);
        status = GameStatus.IN_PROGRESS;
        startRound(1);
    }

    // ---------------------------------------------------------------- turns

    public Player getCurrentPlayer() {
        if (status == GameStatus.COMPLETED) throw new GameStateException("Game is already completed", id);
        if (status == GameStatus.CANCELLED) throw new GameStateException("Game was cancelled", id);
        return players.get(seats.get(turnIndex));
    }

    /** Places one held card. In Pineapple a dealt street must go through {@link #applyPineappleAction}. */
    public void placeCard(String playerId, Card card, Row row) {
        Player p = requireTurn(playerId);
        if (p.isInFantasyLand()) throw new GameStateException("A Fantasy Land hand is set all at once", id);
        if (rules.isPineapple() && p.isHoldingStreet())
            throw new GameStateException("A Pineapple street must be played as place-two, discard-one", id);
        if (!p.canPlaceCard(card, row))
            throw new InvalidCardPlacementException("Cannot place " + card + " at " + row.getDisplayName() + " for player " + playerId, card, row);

        p.placeCard(card, row);
        recordPlacement(p, card, row);
        endTurn();
    }

    /** Sets all initial cards at once, one per slot. */
    public void applyInitialPlacement(InitialPlacement placement) {
        Player p = requireTurn(placement.playerId());
        if (p.isInFantasyLand()) throw new GameStateException("A Fantasy Land hand is set all at once", id);
        if (p.placedCount() > 0) throw new GameStateException("Player " + p.getId() + " already placed initial cards", id);
        if (placement.placements().size() != rules.getInitialCardsCount())
            throw new InvalidCardPlacementException("Must place " + rules.getInitialCardsCount()
                    + " cards initially, got " + placement.placements().size());
        checkPlacements(p, placement.placements());

        placeAll(p, placement.placements());
        endTurn();
    }

    /** Pineapple street: two of the three held cards placed, the third discarded. */
    public void applyPineappleAction(PineappleAction action) {
        if (!rules.isPineapple()) throw new GameStateException("Not a Pineapple game", id);
        Player p = requireTurn(action.playerId());
        if (!p.isHoldingStreet()) throw new GameStateException("Player " + p.getId() + " has no street to play", id);
        if (action.dealtCards().size() != rules.getCardsPerTurn())
            throw new InvalidCardPlacementException("Must deal " + rules.getCardsPerTurn() + " cards, got " + action.dealtCards().size());
        if (action.placements().size() != rules.getCardsPerTurn() - 1)
            throw new InvalidCardPlacementException("Must place " + (rules.getCardsPerTurn() - 1) + " cards, got " + action.placements().size());
        Set<Card> used = new HashSet<>(action.placedCards());
        used.add(action.discardedCard());
        if (!used.equals(new HashSet<>(action.dealtCards())) || !used.equals(new HashSet<>(p.getHandCards())))
            throw new InvalidCardPlacementException("Placed and discarded cards must match the dealt street");
        checkPlacements(p, action.placements());

        p.discard(action.discardedCard());
        discards.add(action.discardedCard());
        placeAll(p, action.placements());
        endTurn();
    }

    /** Sets a whole Fantasy Land hand; the leftover card(s) are discarded. */
    public void applyFantasyLandPlacement(FantasyLandPlacement placement) {
        Player p = requireTurn(placement.playerId());
        if (!p.isInFantasyLand()) throw new GameStateException("Player " + p.getId() + " is not in Fantasy Land", id);

        List<Card> left = p.placeFantasyLandLayout(placement.placements());
        discards.addAll(left);
        placement.placements().stream()
                .sorted(PLACEMENT_ORDER)
                .forEach(pl -> recordPlacement(p, pl.card(), pl.row()));
        endTurn();
    }

    /** Removes a player from the hand; the game is cancelled when nobody is left. */
    public void forfeit(String playerId) {
        if (status.isTerminal()) throw new GameStateException("Game is already over", id);
        Player p = players.get(playerId);
        if (p == null) throw new GameStateException("Player " + playerId + " not in game", id);
        if (!p.isActiveInHand()) throw new GameStateException("Player " + playerId + " already left", id);

        boolean wasCurrent = seats.get(turnIndex).equals(playerId);
        p.eliminate();
        version++;
        int remaining = (int) players.values().stream().filter(Player::isActiveInHand).count();
        pendingEvents.add(new PlayerForfeitedEvent(id, playerId, remaining, clock.instant()));

        if (remaining == 0) {
            status = GameStatus.CANCELLED;
            return;
        }
        if (wasCurrent) advanceTurn();
        if (isRoundComplete()) completeRound();
        if (isGameComplete()) completeGame();
    }

    public void pause() {
        if (status != GameStatus.IN_PROGRESS) throw new GameStateException("Only a running game can be paused", id);
        status = GameStatus.PAUSED;
        version++;
    }

    public void resume() {
        if (status != GameStatus.PAUSED) throw new GameStateException("Game is not paused", id);
        status = GameStatus.IN_PROGRESS;
        version++;
    }

    public void cancel() {
        if (status.isTerminal()) throw new GameStateException("Game is already over", id);
        status = GameStatus.CANCELLED;
        version++;
    }

    // ---------------------------------------------------------------- internals

    private static final Comparator<Placement> PLACEMENT_ORDER =
            Comparator.comparing((Placement pl) -> pl.row()).thenComparingInt(pl -> pl.slot().index());

    private Player requireTurn(String playerId) {
        if (status == GameStatus.COMPLETED) throw new GameStateException("Cannot place cards in completed game", id);
        if (status != GameStatus.IN_PROGRESS) throw new GameStateException("Game is " + status, id);
        Player p = players.get(playerId);
        if (p == null) throw new GameStateException("Player " + playerId + " not in game", id);
        if (!getCurrentPlayer().getId().equals(playerId))
            throw new GameStateException("It's not player " + playerId + "'s turn", id);
        return p;
    }

    /** All-or-nothing check of several placements before any of them is applied. */
    private void checkPlacements(Player p, List<Placement> placements) {
        Set<Card> cards = new HashSet<>();
        Set<Slot> slots = new HashSet<>();
        Map<Row, Integer> perRow = new EnumMap<>(Row.class);
        List<Card> held = p.getHandCards();
        for (Placement pl : placements) {
            if (!cards.add(pl.card())) throw new InvalidCardPlacementException("Card " + pl.card() + " placed twice", pl.card(), pl.row());
            if (!slots.add(pl.slot())) throw new InvalidCardPlacementException("Duplicate slot " + pl.slot(), pl.card(), pl.row());
            if (!held.contains(pl.card()))
                throw new InvalidCardPlacementException("Player " + p.getId() + " does not hold " + pl.card(), pl.card(), pl.row());
            if (!p.isSlotFree(pl.slot()))
                throw new InvalidCardPlacementException("Slot " + pl.slot() + " is already taken", pl.card(), pl.row());
            if (p.rowCount(pl.row()) + perRow.merge(pl.row(), 1, Integer::sum) > pl.row().getCapacity())
                throw new InvalidCardPlacementException(pl.row().getDisplayName() + " is full", pl.card(), pl.row());
        }
    }

    private void placeAll(Player p, List<Placement> placements) {
        placements.stream().sorted(PLACEMENT_ORDER).forEach(pl -> {
            p.placeCard(pl.card(), pl.slot());
            recordPlacement(p, pl.card(), pl.row());
        });
    }

    private void recordPlacement(Player p, Card card, Row row) {
        version++;
        placementSequence++;
        pendingEvents.add(new CardPlacedEvent(id, p.getId(), card, row, currentRound, placementSequence, clock.instant()));
    }

    private void endTurn() {
        advanceTurn();
        if (isRoundComplete()) completeRound();
        if (isGameComplete()) completeGame();
    }

    /** Next seat, skipping players with nothing left to place. */
    private void advanceTurn() {
        int n = seats.size();
        for (int k = 1; k <= n; k++) {
            int i = (turnIndex + k) % n;
            if (players.get(seats.get(i)).needsTurn()) {
                turnIndex = i;
                return;
            }
        }
    }

    private boolean isRoundComplete() {
        return players.values().stream().allMatch(p -> p.hasPlacedThisRound() || !p.needsTurn());
    }

    private void completeRound() {
        currentRound++;
        players.values().forEach(Player::startNewRound);
        if (!isGameComplete()) {
            DealingRules.dealStreet(deck, players.values(), rules);
            if (!players.get(seats.get(turnIndex)).needsTurn()) advanceTurn();
            startRound(currentRound);
        }
    }

    private void startRound(int round) {
        currentRound = round;
        pendingEvents.add(new RoundStartedEvent(id, round, seats.get(turnIndex), deck.size(), clock.instant()));
    }

    private boolean isGameComplete() {
        boolean anyActive = false;
        for (Player p : players.values()) {
            if (!p.isActiveInHand()) continue;
            anyActive = true;
            if (!p.isLayoutComplete()) return false;
        }
        return anyActive;
    }

    private void completeGame() {
        if (status == GameStatus.COMPLETED) return;

        checkFantasyLandQualification();

        completedAt = clock.instant();
        finalScores = Collections.unmodifiableMap(calculateScores());
        winnerId = pickWinner(finalScores);
        status = GameStatus.COMPLETED;
        version++;

        pendingEvents.add(new GameCompletedEvent(id, finalScores, winnerId,
                Duration.between(createdAt, completedAt).getSeconds(), completedAt));
    }

    private void checkFantasyLandQualification() {
        if (!rules.isFantasyLandEnabled()) return;
        for (Player p : players.values()) {
            FantasyLandState st = fantasyLandStates.get(p.getId());
            if (p.isDead() || !p.isLayoutComplete()) {
                if (p.isInFantasyLand()) {
                    p.exitFantasyLand();
                    st = st.exit();
                }
            } else if (p.isInFantasyLand()) {
                if (fantasyLand.checkStayQualification(p.getTopRow(), p.getMiddleRow(), p.getBottomRow(), rules)) {
                    st = st.enter(currentRound);
                } else {
                    p.exitFantasyLand();
                    st = st.exit();
                }
            } else if (fantasyLand.checkEntryQualification(p.getTopRow(), rules)) {
                p.enterFantasyLand();
                st = st.enter(currentRound);
            }
            fantasyLandStates.put(p.getId(), st);
        }
    }

    /**
     * Head-to-head totals over every pair of players plus the royalty exchange. Only final once the
     * game is complete; unfinished layouts score like fouled ones.
     */
    public Map<String, Score> calculateScores() {
        Map<String, Score> scores = new LinkedHashMap<>();
        for (String s : seats) scores.put(s, Score.ZERO);
        for (int i = 0; i < seats.size(); i++) {
            for (int j = i + 1; j < seats.size(); j++) {
                Player a = players.get(seats.get(i)), b = players.get(seats.get(j));
                ScoringRules.Outcome o = ScoringRules.headToHead(a, b, evaluator, rules);
                scores.merge(a.getId(), o.first(), Score::plus);
                scores.merge(b.getId(), o.second(), Score::plus);
            }
        }
        return scores;
    }

    /** Highest total; ties go to higher own royalties, then a live layout, then the earlier seat. */
    private String pickWinner(Map<String, Score> scores) {
        Comparator<String> order = Comparator
                .comparingInt((String pid) -> scores.get(pid).total()).reversed()
                .thenComparing(Comparator.comparingInt((String pid) -> players.get(pid).royalties(rules.getRoyalties())).reversed())
                .thenComparing(pid -> players.get(pid).isDead())
                .thenComparingInt(seats::indexOf);
        return seats.stream().sorted(order).findFirst().orElseThrow();
    }

    // ---------------------------------------------------------------- queries

    public boolean isCompleted() { return status == GameStatus.COMPLETED; }

    public List<Player> getPlayers() {
        List<Player> out = new ArrayList<>(seats.size());
        for (String s : seats) out.add(players.get(s));
        return out;
    }

    public Optional<Player> getPlayer(String playerId) { return Optional.ofNullable(players.get(playerId)); }

    public List<Card> getRemainingCards() { return deck.remainingCards(); }

    public List<Card> getDiscards() { return List.copyOf(discards); }

    public Map<String, Score> getFinalScores() { return finalScores; }

    public FantasyLandState getFantasyLandState(String playerId) { return fantasyLandStates.get(playerId); }

    public Map<String, FantasyLandState> getFantasyLandStates() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(fantasyLandStates));
    }

    public boolean validateLayout(String playerId) {
        Player p = players.get(playerId);
        return p != null && p.validateLayout();
    }

    public AnalysisPosition getAnalysisPosition() {
        Map<String, HandSnapshot> hands = new LinkedHashMap<>();
        for (String s : seats) hands.put(s, players.get(s).getCurrentHand());
        String current = status.isTerminal() ? null : seats.get(turnIndex);
        return new AnalysisPosition(id, version, status, hands, deck.remainingCards(), current, currentRound, rules);
    }

    /** Events recorded since the last call, oldest first. */
    public List<GameEvent> pullEvents() {
        List<GameEvent> out = List.copyOf(pendingEvents);
        pendingEvents.clear();
        return out;
    }

    @Override
    public String toString() {
        String s = isCompleted() ? "completed" : "round " + currentRound;
        return "Game(id=" + id + ", players=" + seats.size() + ", status=" + s + ")";
    }
}
