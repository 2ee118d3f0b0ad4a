package org.ofc.model.rules;

import org.ofc.model.GameRules;
import org.ofc.model.HandRanking;
import org.ofc.model.Player;
import org.ofc.model.Row;
import org.ofc.model.Score;
import org.ofc.service.engine.HandEvaluator;

public final class ScoringRules {
    private ScoringRules(){}

    /** What each side of one head-to-head gets. */
    public record Outcome(Score first, Score second, int firstRows, int secondRows) {}

    /**
     * One point per row won, a scoop bonus when all three rows are won, both times the point
     * multiplier; royalties are then exchanged. A fouled or eliminated player loses every row
     * against a live opponent and two dead players exchange nothing.
     */
    public static Outcome headToHead(Player a, Player b, HandEvaluator evaluator, GameRules rules) {
        boolean deadA = isDead(a), deadB = isDead(b);
        if (deadA && deadB) return new Outcome(Score.ZERO, Score.ZERO, 0, 0);

        int rowsA = 0, rowsB = 0;
        if (deadA) rowsB = 3;
        else if (deadB) rowsA = 3;
        else {
            for (Row r : Row.values()) {
                HandRanking ha = evaluator.evaluate(a.getRowCards(r), r, rules.getRoyalties());
                HandRanking hb = evaluator.evaluate(b.getRowCards(r), r, rules.getRoyalties());
                int c = evaluator.compare(ha, hb);
                if (c > 0) rowsA++;
                else if (c < 0) rowsB++;
            }
        }

        int wonA = rowPoints(rowsA, rules);
        int wonB = rowPoints(rowsB, rules);
        int royA = a.royalties(rules.getRoyalties());
        int royB = b.royalties(rules.getRoyalties());

        return new Outcome(
                new Score(wonA, royA, wonB + royB),
                new Score(wonB, royB, wonA + royA),
                rowsA, rowsB);
    }

    private static int rowPoints(int rowsWon, GameRules rules) {
        int pts = rowsWon + (rowsWon == Row.values().length ? rules.getScoopBonus() : 0);
        return pts * rules.getPointMultiplier();
    }

    private static boolean isDead(Player p) {
        return p.isDead() || !p.isLayoutComplete();
    }
}
