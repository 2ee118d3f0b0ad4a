package org.ofc.support;

import org.ofc.dto.InitialPlacement;
import org.ofc.dto.PineappleAction;
import org.ofc.dto.Placement;
import org.ofc.model.Card;
import org.ofc.model.Deck;
import org.ofc.model.Game;
import org.ofc.model.Row;
import org.ofc.model.Slot;

import java.util.*;

/**
 * Builds a stacked deck from the final layouts each player should end with, and replays the
 * moves that produce them: the first five cards (top, then middle, then bottom) as the initial
 * placement, the rest one card per street, or two per street plus a discard in Pineapple.
 */
public final class ScriptedHand {
    private final Map<String, List<Placement>> layouts = new LinkedHashMap<>();
    private final Map<String, List<Card>> discards = new LinkedHashMap<>();

    public ScriptedHand seat(String id, String top, String middle, String bottom) {
        return seat(id, top, middle, bottom, "");
    }

    /** {@code discards} holds one card per Pineapple street, in street order. */
    public ScriptedHand seat(String id, String top, String middle, String bottom, String discards) {
        List<Placement> seq = new ArrayList<>();
        add(seq, Row.TOP, top);
        add(seq, Row.MIDDLE, middle);
        add(seq, Row.BOTTOM, bottom);
        if (seq.size() != Row.LAYOUT_SIZE) throw new IllegalArgumentException("Layout of " + id + " has " + seq.size() + " cards");
        layouts.put(id, seq);
        this.discards.put(id, cards(discards));
        return this;
    }

    public List<String> playerIds() { return new ArrayList<>(layouts.keySet()); }

    public static List<Card> cards(String codes) {
        if (codes.isBlank()) return List.of();
        return Card.parseAll(codes.trim().split("\\s+"));
    }

    /** All placements of one row of codes, slots in order. */
    public static List<Placement> row(Row row, String codes) {
        List<Placement> out = new ArrayList<>();
        add(out, row, codes);
        return out;
    }

    private static void add(List<Placement> seq, Row row, String codes) {
        List<Card> cs = cards(codes);
        for (int i = 0; i < cs.size(); i++) seq.add(new Placement(cs.get(i), Slot.of(row, i)));
    }

    /** Deck for a standard hand: initial fives in seat order, then one card per player per street. */
    public Deck standardDeck() {
        List<Card> order = new ArrayList<>();
        for (List<Placement> seq : layouts.values()) for (int i = 0; i < 5; i++) order.add(seq.get(i).card());
        for (int i = 5; i < Row.LAYOUT_SIZE; i++) for (List<Placement> seq : layouts.values()) order.add(seq.get(i).card());
        return Deck.stacked(order);
    }

    /** Deck for a Pineapple hand: initial fives in seat order, then each player's 3-card street. */
    public Deck pineappleDeck() {
        List<Card> order = new ArrayList<>();
        for (List<Placement> seq : layouts.values()) for (int i = 0; i < 5; i++) order.add(seq.get(i).card());
        for (int s = 0; s < 4; s++) {
            for (String id : layouts.keySet()) order.addAll(pineappleStreet(id, s).dealtCards());
        }
        return Deck.stacked(order);
    }

    public InitialPlacement initial(String id) {
        return new InitialPlacement(id, layouts.get(id).subList(0, 5));
    }

    public Placement street(String id, int street) {
        return layouts.get(id).get(5 + street);
    }

    public PineappleAction pineappleStreet(String id, int street) {
        List<Placement> placed = layouts.get(id).subList(5 + 2 * street, 7 + 2 * street);
        Card discard = discards.get(id).get(street);
        List<Card> dealt = new ArrayList<>();
        for (Placement p : placed) dealt.add(p.card());
        dealt.add(discard);
        return new PineappleAction(id, dealt, placed, discard);
    }

    public List<Placement> layout(String id) { return layouts.get(id); }

    public void playStandard(Game game) {
        for (String id : layouts.keySet()) game.applyInitialPlacement(initial(id));
        for (int s = 0; s < 8; s++) {
            for (String id : layouts.keySet()) {
                Placement p = street(id, s);
                game.placeCard(id, p.card(), p.row());
            }
        }
    }

    public void playPineapple(Game game) {
        for (String id : layouts.keySet()) game.applyInitialPlacement(initial(id));
        for (int s = 0; s < 4; s++) {
            for (String id : layouts.keySet()) game.applyPineappleAction(pineappleStreet(id, s));
        }
    }
}
