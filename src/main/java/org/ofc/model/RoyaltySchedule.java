package org.ofc.model;

/** Which royalty table applies; see {@link org.ofc.model.rules.RoyaltyRules}. */
public enum RoyaltySchedule {
    CLASSIC,
    PINEAPPLE;

    public static RoyaltySchedule parse(String s) {
        if (s == null) throw new IllegalArgumentException("Royalty schedule is required");
        for (RoyaltySchedule r : values()) {
            if (r.name().equalsIgnoreCase(s.trim())) return r;
        }
        throw new IllegalArgumentException("Invalid royalty schedule: " + s);
    }
}
