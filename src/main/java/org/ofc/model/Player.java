package org.ofc.model;

import lombok.Getter;
import org.ofc.dto.Placement;
import org.ofc.exception.GameStateException;
import org.ofc.exception.InvalidCardPlacementException;
import org.ofc.service.engine.HandEvaluator;

import java.util.*;

/**
 * One participant's layout: three rows, the cards held but not yet placed and the Fantasy Land
 * pool. Owned by its {@link Game}; nothing here touches another player.
 */
public class Player {
    @Getter private final String id;
    @Getter private final String name;
    @Getter private final GameRules rules;
    private final HandEvaluator evaluator;

    @Getter private PlayerStatus status = PlayerStatus.ACTIVE;
    private final Map<Row, Card[]> rows = new EnumMap<>(Row.class);
    private final List<Card> handCards = new ArrayList<>();
    private final List<Card> fantasyLandCards = new ArrayList<>();
    private boolean placedThisRound = false;
    @Getter private boolean inFantasyLand = false;
    private boolean holdingStreet = false;

    public Player(String id, String name, GameRules rules, HandEvaluator evaluator) {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("Player id is required");
        this.id = id;
        this.name = name != null ? name : id;
        this.rules = Objects.requireNonNull(rules, "rules");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        for (Row r : Row.values()) rows.put(r, new Card[r.getCapacity()]);
    }

    // ---------------------------------------------------------------- dealing

    public void receiveInitialCards(List<Card> cards) {
        if (inFantasyLand) throw new GameStateException("Player " + id + " is in Fantasy Land and gets a full hand");
        if (!handCards.isEmpty()) throw new GameStateException("Player " + id + " already has cards");
        if (cards.size() != rules.getInitialCardsCount())
            throw new GameStateException("Initial deal must be exactly " + rules.getInitialCardsCount() + " cards, got " + cards.size());
        handCards.addAll(cards);
    }

    public void receiveFantasyLandCards(List<Card> cards) {
        if (!inFantasyLand) throw new GameStateException("Player " + id + " is not in Fantasy Land");
        if (!fantasyLandCards.isEmpty() || placedCount() > 0)
            throw new GameStateException("Player " + id + " already received a Fantasy Land hand");
        if (cards.size() != rules.fantasyLandCardCount())
            throw new GameStateException("Fantasy Land deal must be exactly " + rules.fantasyLandCardCount() + " cards, got " + cards.size());
        fantasyLandCards.addAll(cards);
    }

    public void receiveCard(Card card) {
        if (inFantasyLand) fantasyLandCards.add(card);
        else handCards.add(card);
    }

    public void receiveCards(List<Card> cards) {
        for (Card c : cards) receiveCard(c);
    }

    /** A Pineapple street, to be resolved by placing two cards and discarding one. */
    public void receiveStreetCards(List<Card> cards) {
        if (!handCards.isEmpty()) throw new GameStateException("Player " + id + " still holds cards");
        handCards.addAll(cards);
        holdingStreet = true;
    }

    // ---------------------------------------------------------------- placement

    public boolean canPlaceCard(Card card, Row row) {
        return status != PlayerStatus.ELIMINATED
                && handCards.contains(card)
                && rowCount(row) < row.getCapacity();
    }

    public boolean isSlotFree(Slot slot) {
        return rows.get(slot.row())[slot.index()] == null;
    }

    /** Places into the lowest free slot of the row. */
    public void placeCard(Card card, Row row) {
        if (!canPlaceCard(card, row))
            throw new InvalidCardPlacementException("Cannot place " + card + " at " + row.getDisplayName() + " for player " + id, card, row);
        Card[] slots = rows.get(row);
        int index = 0;
        while (slots[index] != null) index++;
        put(card, row, index);
    }

    public void placeCard(Card card, Slot slot) {
        if (!canPlaceCard(card, slot.row()) || !isSlotFree(slot))
            throw new InvalidCardPlacementException("Cannot place " + card + " at " + slot + " for player " + id, card, slot.row());
        put(card, slot.row(), slot.index());
    }

    private void put(Card card, Row row, int index) {
        handCards.remove(card);
        rows.get(row)[index] = card;
        if (handCards.isEmpty()) holdingStreet = false;
        placedThisRound = true;
        checkFoul();
    }

    public void discard(Card card) {
        if (!handCards.remove(card)) throw new InvalidCardPlacementException("Player " + id + " does not hold " + card, card, null);
        if (handCards.isEmpty()) holdingStreet = false;
    }

    /**
     * Sets a whole Fantasy Land hand.
     *
     * @return the dealt cards left out of the layout, now discarded
     */
    public List<Card> placeFantasyLandLayout(List<Placement> placements) {
        if (!inFantasyLand || fantasyLandCards.isEmpty())
            throw new GameStateException("Player " + id + " has no Fantasy Land hand to set");
        if (placedCount() > 0) throw new GameStateException("Player " + id + " already started a layout");
        if (placements.size() != Row.LAYOUT_SIZE)
            throw new InvalidCardPlacementException("Fantasy Land layout needs " + Row.LAYOUT_SIZE + " cards, got " + placements.size());
        Map<Row, Integer> perRow = new EnumMap<>(Row.class);
        Set<Card> seen = new HashSet<>();
        Set<Slot> taken = new HashSet<>();
        for (Placement p : placements) {
            if (!fantasyLandCards.contains(p.card()) || !seen.add(p.card()))
                throw new InvalidCardPlacementException("Card " + p.card() + " is not available to player " + id, p.card(), p.row());
            if (!taken.add(p.slot()))
                throw new InvalidCardPlacementException("Duplicate slot " + p.slot(), p.card(), p.row());
            perRow.merge(p.row(), 1, Integer::sum);
        }
        for (Row r : Row.values()) {
            if (perRow.getOrDefault(r, 0) != r.getCapacity())
                throw new InvalidCardPlacementException(r.getDisplayName() + " needs " + r.getCapacity() + " cards", null, r);
        }
        for (Placement p : placements) rows.get(p.row())[p.slot().index()] = p.card();
        fantasyLandCards.removeAll(seen);
        List<Card> discards = new ArrayList<>(fantasyLandCards);
        fantasyLandCards.clear();
        placedThisRound = true;
        checkFoul();
        return discards;
    }

    private void checkFoul() {
        if (isLayoutComplete() && !validateLayout()) status = PlayerStatus.FOULED;
    }

    /** True for any unfinished layout; for a complete one, bottom &gt; middle &gt; top. */
    public boolean validateLayout() {
        if (!isLayoutComplete()) return true;
        return evaluator.validateOfcProgression(getTopRow(), getMiddleRow(), getBottomRow());
    }

    public List<Row> getAvailablePositions() {
        List<Row> out = new ArrayList<>(3);
        for (Row r : Row.values()) if (rowCount(r) < r.getCapacity()) out.add(r);
        return out;
    }

    // ---------------------------------------------------------------- state

    public void startNewRound() { placedThisRound = false; }

    public boolean hasPlacedThisRound() { return placedThisRound; }

    public boolean isHoldingStreet() { return holdingStreet; }

    public void enterFantasyLand() {
        inFantasyLand = true;
        if (status == PlayerStatus.ACTIVE) status = PlayerStatus.FANTASY_LAND;
    }

    public void exitFantasyLand() {
        inFantasyLand = false;
        if (status == PlayerStatus.FANTASY_LAND) status = PlayerStatus.ACTIVE;
        fantasyLandCards.clear();
    }

    public void eliminate() { status = PlayerStatus.ELIMINATED; }

    public boolean isActiveInHand() { return status != PlayerStatus.ELIMINATED; }

    /** Fouled or eliminated: loses every row and earns no royalty. */
    public boolean isDead() { return status == PlayerStatus.FOULED || status == PlayerStatus.ELIMINATED; }

    /** Still has cards to place this hand. */
    public boolean needsTurn() { return isActiveInHand() && !isLayoutComplete(); }

    public boolean isLayoutComplete() { return placedCount() == Row.LAYOUT_SIZE; }

    public int placedCount() {
        int n = 0;
        for (Row r : Row.values()) n += rowCount(r);
        return n;
    }

    public int rowCount(Row row) {
        int n = 0;
        for (Card c : rows.get(row)) if (c != null) n++;
        return n;
    }

    public int openSlots() { return Row.LAYOUT_SIZE - placedCount(); }

    public int royalties(RoyaltySchedule schedule) {
        if (!isLayoutComplete() || isDead()) return 0;
        int sum = 0;
        for (Row r : Row.values()) sum += evaluator.evaluate(getRowCards(r), r, schedule).royaltyBonus();
        return sum;
    }

    /** Placed cards of a row in slot order, open slots skipped. */
    public List<Card> getRowCards(Row row) {
        List<Card> out = new ArrayList<>(row.getCapacity());
        for (Card c : rows.get(row)) if (c != null) out.add(c);
        return List.copyOf(out);
    }

    public List<Card> getTopRow() { return getRowCards(Row.TOP); }

    public List<Card> getMiddleRow() { return getRowCards(Row.MIDDLE); }

    public List<Card> getBottomRow() { return getRowCards(Row.BOTTOM); }

    public List<Card> getHandCards() { return List.copyOf(handCards); }

    public List<Card> getFantasyLandCards() { return List.copyOf(fantasyLandCards); }

    /** Every card this player currently owns: rows, hand and Fantasy Land pool. */
    public List<Card> allCards() {
        List<Card> out = new ArrayList<>(handCards);
        out.addAll(fantasyLandCards);
        for (Row r : Row.values()) out.addAll(getRowCards(r));
        return out;
    }

    public HandSnapshot getCurrentHand() {
        List<Card> held = new ArrayList<>(handCards);
        held.addAll(fantasyLandCards);
        return new HandSnapshot(getTopRow(), getMiddleRow(), getBottomRow(), held);
    }

    @Override
    public String toString() {
        return "Player(id=" + id + ", name='" + name + "', cardsPlaced=" + placedCount() + ", status=" + status + ")";
    }
}
