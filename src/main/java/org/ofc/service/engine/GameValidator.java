package org.ofc.service.engine;

import lombok.RequiredArgsConstructor;
import org.ofc.dto.FantasyLandPlacement;
import org.ofc.dto.InitialPlacement;
import org.ofc.dto.PineappleAction;
import org.ofc.dto.Placement;
import org.ofc.model.*;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Re-derives the game's invariants from the current state without mutating anything. Rule
 * violations come back as {@link ValidationResult}s, never as exceptions.
 */
@Service
@RequiredArgsConstructor
public class GameValidator {
    private final HandEvaluator evaluator;
    private final FantasyLandManager fantasyLand;

    public ValidationResult validateCardPlacement(Game game, String playerId, Card card, Row row) {
        if (game.isCompleted()) return ValidationResult.error("Cannot place cards in completed game");
        if (game.getStatus() != GameStatus.IN_PROGRESS) return ValidationResult.error("Game is " + game.getStatus());

        Optional<Player> found = game.getPlayer(playerId);
        if (found.isEmpty()) return ValidationResult.error("Player " + playerId + " not in game");
        Player player = found.get();

        if (!game.getCurrentPlayer().getId().equals(playerId))
            return ValidationResult.error("It's not player " + playerId + "'s turn");
        if (player.isInFantasyLand())
            return ValidationResult.error("Player " + playerId + " must set the whole Fantasy Land hand at once");
        if (game.getRules().isPineapple() && player.isHoldingStreet())
            return ValidationResult.error("Player " + playerId + " must place two and discard one of the dealt street");
        if (!player.getHandCards().contains(card))
            return ValidationResult.error("Player " + playerId + " does not have card " + card);

        int filled = player.getRowCards(row).size();
        if (filled >= row.getCapacity())
            return ValidationResult.error(row.getDisplayName() + " is full (" + filled + "/" + row.getCapacity() + ")");
        if (isCardAlreadyUsed(game, card))
            return ValidationResult.error("Card " + card + " is already placed in the game");

        return ValidationResult.ok();
    }

    public ValidationResult validateRowStrengthProgression(Player player) {
        if (!player.isLayoutComplete())
            return ValidationResult.warning("Player layout not complete, skipping progression validation");
        if (player.getStatus() == PlayerStatus.FOULED) return ValidationResult.error("Player has fouled hand");
        if (!evaluator.validateOfcProgression(player.getTopRow(), player.getMiddleRow(), player.getBottomRow()))
            return ValidationResult.error("Hand violates OFC progression rules (bottom > middle > top)");
        return ValidationResult.ok();
    }

    public ValidationResult checkGameCompletion(Game game) {
        if (game.isCompleted()) return ValidationResult.warning("Game is already completed");

        List<String> incomplete = new ArrayList<>();
        int placed = 0, expected = 0;
        for (Player p : game.getPlayers()) {
            if (!p.isActiveInHand()) continue;
            if (!p.isLayoutComplete()) incomplete.add(p.getName());
            placed += p.placedCount();
            expected += Row.LAYOUT_SIZE;
        }
        if (!incomplete.isEmpty())
            return ValidationResult.error("Players still need to complete layouts: " + String.join(", ", incomplete));
        if (placed != expected)
            return ValidationResult.error("Card count mismatch: " + placed + " placed, " + expected + " expected");
        return ValidationResult.ok();
    }

    public ValidationResult validateTurnOrder(Game game, String playerId) {
        if (game.getStatus().isTerminal()) return ValidationResult.error("Game is completed, no more turns");
        Player current = game.getCurrentPlayer();
        if (!current.getId().equals(playerId))
            return ValidationResult.error("It's " + current.getName() + "'s turn, not player " + playerId);
        return ValidationResult.ok();
    }

    /** Player count, unique ids, all 52 cards accounted for exactly once, fouled layouts as a warning. */
    public ValidationResult validateMultiPlayerGameState(Game game) {
        List<Player> players = game.getPlayers();
        if (players.size() < GameRules.MIN_PLAYERS || players.size() > GameRules.MAX_PLAYERS)
            return ValidationResult.error("Invalid player count: " + players.size() + " (must be 2-4)");
        Set<String> ids = players.stream().map(Player::getId).collect(Collectors.toSet());
        if (ids.size() != players.size()) return ValidationResult.error("Duplicate player IDs found");

        List<Card> all = new ArrayList<>(game.getRemainingCards());
        for (Player p : players) all.addAll(p.allCards());
        all.addAll(game.getDiscards());
        Set<Card> distinct = new HashSet<>(all);
        if (distinct.size() != all.size()) return ValidationResult.error("Duplicate cards found in game");
        if (all.size() != 52) return ValidationResult.error("Card count mismatch: " + all.size() + " of 52 accounted for");

        List<String> fouled = players.stream()
                .filter(Player::isLayoutComplete)
                .filter(p -> !validateRowStrengthProgression(p).valid())
                .map(Player::getName)
                .collect(Collectors.toList());
        if (!fouled.isEmpty())
            return ValidationResult.warning("Players with fouled hands: " + String.join(", ", fouled));
        return ValidationResult.ok();
    }

    /**
     * Legal placements pass; a warning is attached when the placement completes a fouled layout or
     * leaves an upper row holding a made hand stronger than the row below it.
     */
    public ValidationResult canPlaceCardSafely(Game game, String playerId, Card card, Row row) {
        ValidationResult basic = validateCardPlacement(game, playerId, card, row);
        if (!basic.valid()) return basic;

        Player player = game.getPlayer(playerId).orElseThrow();
        Map<Row, List<Card>> sim = new EnumMap<>(Row.class);
        for (Row r : Row.values()) sim.put(r, new ArrayList<>(player.getRowCards(r)));
        sim.get(row).add(card);

        List<Card> top = sim.get(Row.TOP), middle = sim.get(Row.MIDDLE), bottom = sim.get(Row.BOTTOM);
        String warning = "Warning: placing " + card + " at " + row.getDisplayName() + " may lead to fouling";
        if (top.size() + middle.size() + bottom.size() == Row.LAYOUT_SIZE) {
            return evaluator.isFouledHand(top, middle, bottom)
                    ? ValidationResult.warning("Warning: placing " + card + " at " + row.getDisplayName() + " fouls the hand")
                    : ValidationResult.ok();
        }
        if (upperAlreadyBeats(top, middle) || upperAlreadyBeats(middle, bottom)) return ValidationResult.warning(warning);
        return ValidationResult.ok();
    }

    private boolean upperAlreadyBeats(List<Card> upper, List<Card> lower) {
        if (upper.isEmpty() || lower.isEmpty()) return false;
        HandRanking u = evaluator.evaluatePartial(upper);
        if (u.handType() == HandType.HIGH_CARD) return false;
        return evaluator.compare(u, evaluator.evaluatePartial(lower)) > 0;
    }

    public List<Row> getAvailablePositions(Game game, String playerId) {
        return game.getPlayer(playerId).map(Player::getAvailablePositions).orElse(List.of());
    }

    // ---------------------------------------------------------------- multi-card actions

    public ValidationResult validatePineappleAction(PineappleAction action, Game game) {
        int street = game.getRules().getCardsPerTurn();
        if (action.dealtCards().size() != street)
            return ValidationResult.error("Must deal " + street + " cards, got " + action.dealtCards().size());

        ValidationResult turn = validateTurnOrder(game, action.playerId());
        if (!turn.valid()) return ValidationResult.error("Not player's turn");
        if (!game.getRules().isPineapple()) return ValidationResult.error("Not a Pineapple game");

        if (action.placements().size() != street - 1)
            return ValidationResult.error("Must place " + (street - 1) + " cards, got " + action.placements().size());

        Set<Card> used = new HashSet<>(action.placedCards());
        used.add(action.discardedCard());
        if (!used.equals(new HashSet<>(action.dealtCards())))
            return ValidationResult.error("Placed and discarded cards must match dealt cards");

        Player player = game.getPlayer(action.playerId()).orElseThrow();
        if (!player.isHoldingStreet()) return ValidationResult.error("Player " + player.getId() + " has no street to play");

        ValidationResult slots = checkDistinctSlots(action.placements());
        if (!slots.valid()) return slots;

        if (!new HashSet<>(player.getHandCards()).equals(new HashSet<>(action.dealtCards())))
            return ValidationResult.error("Dealt cards do not match the cards player " + player.getId() + " holds");
        for (Card c : action.dealtCards()) {
            if (isCardAlreadyUsed(game, c)) return ValidationResult.error("Card " + c + " already used in game");
        }
        return checkSlotsFree(player, action.placements());
    }

    public ValidationResult validateInitialPlacement(InitialPlacement placement, Game game) {
        int expected = game.getRules().getInitialCardsCount();
        if (placement.placements().size() != expected)
            return ValidationResult.error("Must place " + expected + " cards initially, got " + placement.placements().size());

        ValidationResult slots = checkDistinctSlots(placement.placements());
        if (!slots.valid()) return slots;

        ValidationResult turn = validateTurnOrder(game, placement.playerId());
        if (!turn.valid()) return turn;

        Player player = game.getPlayer(placement.playerId()).orElseThrow();
        if (player.isInFantasyLand()) return ValidationResult.error("Player " + player.getId() + " is in Fantasy Land");
        if (player.placedCount() > 0) return ValidationResult.error("Initial cards were already placed");

        Set<Card> seen = new HashSet<>();
        for (Placement p : placement.placements()) {
            if (!seen.add(p.card())) return ValidationResult.error("Card " + p.card() + " placed twice");
            if (isCardAlreadyUsed(game, p.card())) return ValidationResult.error("Card " + p.card() + " already used");
            if (!player.getHandCards().contains(p.card()))
                return ValidationResult.error("Player " + player.getId() + " does not have card " + p.card());
        }
        return checkSlotsFree(player, placement.placements());
    }

    /** Checks entry under the rules the player is playing. */
    public ValidationResult validateFantasyLandEntry(Player player, FantasyLandState state) {
        return validateFantasyLandEntry(player, state, player.getRules());
    }

    public ValidationResult validateFantasyLandEntry(Player player, FantasyLandState state, GameRules rules) {
        if (state.active()) return ValidationResult.error("Player already in Fantasy Land");
        if (!player.isLayoutComplete()) return ValidationResult.error("Player layout not complete");
        if (player.isDead()) return ValidationResult.error("A fouled layout cannot qualify for Fantasy Land");
        if (fantasyLand.checkEntryQualification(player.getTopRow(), rules))
            return ValidationResult.ok();
        String pair = rules.getFantasyLandEntryRank().getSymbol();
        return ValidationResult.error("Top row does not qualify for Fantasy Land (need " + pair + pair + "+)");
    }

    public ValidationResult validateFantasyLandStay(Player player, FantasyLandState state) {
        return validateFantasyLandStay(player, state, player.getRules());
    }

    public ValidationResult validateFantasyLandStay(Player player, FantasyLandState state, GameRules rules) {
        if (!state.active()) return ValidationResult.error("Player not in Fantasy Land");
        if (!player.isLayoutComplete()) return ValidationResult.error("Player layout not complete");
        if (player.isDead()) return ValidationResult.error("A fouled layout cannot stay in Fantasy Land");
        if (fantasyLand.checkStayQualification(player.getTopRow(), player.getMiddleRow(), player.getBottomRow(), rules))
            return ValidationResult.ok();
        return ValidationResult.error("Does not meet requirements to stay in Fantasy Land");
    }

    public ValidationResult validateFantasyLandPlacement(FantasyLandPlacement placement, Game game) {
        ValidationResult turn = validateTurnOrder(game, placement.playerId());
        if (!turn.valid()) return turn;

        Player player = game.getPlayer(placement.playerId()).orElseThrow();
        if (!player.isInFantasyLand() || player.getFantasyLandCards().isEmpty())
            return ValidationResult.error("Player " + player.getId() + " has no Fantasy Land hand to set");

        List<Card> placed = placement.placements().stream().map(Placement::card).collect(Collectors.toList());
        ValidationResult cards = fantasyLand.validateFantasyLandPlacement(
                placed, player.getFantasyLandCards(), game.getRules().getVariant());
        if (!cards.valid()) return cards;

        ValidationResult slots = checkDistinctSlots(placement.placements());
        if (!slots.valid()) return slots;

        Map<Row, Long> perRow = placement.placements().stream()
                .collect(Collectors.groupingBy(Placement::row, () -> new EnumMap<>(Row.class), Collectors.counting()));
        for (Row r : Row.values()) {
            long n = perRow.getOrDefault(r, 0L);
            if (n != r.getCapacity())
                return ValidationResult.error(r.getDisplayName() + " needs " + r.getCapacity() + " cards, got " + n);
        }
        return ValidationResult.ok();
    }

    /**
     * Named checks in a fixed order: {@code game_state}, {@code completion}, {@code player_<id>} for
     * every player and {@code turn_order} while the game is still running.
     */
    public Map<String, ValidationResult> getValidationSummary(Game game) {
        Map<String, ValidationResult> summary = new LinkedHashMap<>();
        summary.put("game_state", validateMultiPlayerGameState(game));
        summary.put("completion", checkGameCompletion(game));
        for (Player p : game.getPlayers()) summary.put("player_" + p.getId(), validateRowStrengthProgression(p));
        if (!game.getStatus().isTerminal())
            summary.put("turn_order", validateTurnOrder(game, game.getCurrentPlayer().getId()));
        return summary;
    }

    // ---------------------------------------------------------------- helpers

    private static ValidationResult checkDistinctSlots(List<Placement> placements) {
        Set<Slot> slots = new HashSet<>();
        for (Placement p : placements) {
            if (!slots.add(p.slot())) return ValidationResult.error("Duplicate positions in placement: " + p.slot());
        }
        return ValidationResult.ok();
    }

    private static ValidationResult checkSlotsFree(Player player, List<Placement> placements) {
        Map<Row, Integer> perRow = new EnumMap<>(Row.class);
        for (Placement p : placements) {
            if (!player.isSlotFree(p.slot()))
                return ValidationResult.error("Cannot place card at " + p.slot() + ": slot taken");
            if (player.rowCount(p.row()) + perRow.merge(p.row(), 1, Integer::sum) > p.row().getCapacity())
                return ValidationResult.error("Cannot place card at " + p.slot() + ": " + p.row().getDisplayName() + " is full");
        }
        return ValidationResult.ok();
    }

    /** In any player's rows or among the discards. */
    private static boolean isCardAlreadyUsed(Game game, Card card) {
        if (game.getDiscards().contains(card)) return true;
        for (Player p : game.getPlayers()) {
            for (Row r : Row.values()) if (p.getRowCards(r).contains(card)) return true;
        }
        return false;
    }
}
