package org.ofc.model;

/** A physical position inside a row, {@code 0 <= index < row.capacity()}. */
public record Slot(Row row, int index) {
    public Slot {
        if (row == null) throw new IllegalArgumentException("Row is required");
        if (index < 0 || index >= row.getCapacity())
            throw new IllegalArgumentException(row.getDisplayName() + " has no slot " + index);
    }

    public static Slot of(Row row, int index) { return new Slot(row, index); }
}
