package org.ofc.model;

/**
 * Final score of one player.
 *
 * @param points    row and scoop points won against opponents
 * @param royalties royalties collected from opponents
 * @param penalties row and scoop points lost plus royalties paid
 */
public record Score(int points, int royalties, int penalties) {

    public static final Score ZERO = new Score(0, 0, 0);

    public int total() { return points + royalties - penalties; }

    public Score plus(Score o) {
        return new Score(points + o.points, royalties + o.royalties, penalties + o.penalties);
    }
}
