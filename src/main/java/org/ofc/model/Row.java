package org.ofc.model;

import lombok.Getter;

@Getter
public enum Row {
    TOP(3, "Top Row"),
    MIDDLE(5, "Middle Row"),
    BOTTOM(5, "Bottom Row");

    public static final int LAYOUT_SIZE = 13;

    private final int capacity;
    private final String displayName;

    Row(int capacity, String displayName) {
        this.capacity = capacity;
        this.displayName = displayName;
    }

    public static Row parse(String s) {
        if (s == null) throw new IllegalArgumentException("Row is required");
        String v = s.trim();
        for (Row r : values()) {
            if (r.name().equalsIgnoreCase(v)) return r;
        }
        throw new IllegalArgumentException("Invalid row: " + s);
    }
}
