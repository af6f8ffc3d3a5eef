package com.tazifor.rotator.inventory;

import java.util.Arrays;

/**
 * Maps a position in a {@link CumulativeWeights} table back to a banner position.
 * <p>
 * Two variants, told apart by {@link Kind}:
 * <ul>
 *   <li>{@link Kind#IDENTITY}: the table covers every banner, table position = banner position.</li>
 *   <li>{@link Kind#EXPLICIT}: the table covers a subset; {@code positions[i]} is the banner
 *       behind table position {@code i}.</li>
 * </ul>
 * The variants only differ in {@link #project(int)}.
 */
public final class IndexProjection {

    public enum Kind { IDENTITY, EXPLICIT }

    private static final int DEFAULT_CAPACITY = 8;

    private final Kind kind;
    private int[] positions;
    private int size;

    private IndexProjection(Kind kind, int capacity) {
        this.kind = kind;
        this.positions = kind == Kind.EXPLICIT ? new int[Math.max(capacity, 1)] : null;
    }

    public static IndexProjection identity() {
        return new IndexProjection(Kind.IDENTITY, 0);
    }

    public static IndexProjection explicit(int expectedSize) {
        return new IndexProjection(Kind.EXPLICIT, expectedSize > 0 ? expectedSize : DEFAULT_CAPACITY);
    }

    public Kind kind() { return kind; }

    /**
     * Appends the banner position behind the next table position.
     *
     * @throws IllegalStateException on an identity projection
     */
    void append(int bannerPosition) {
        if (kind != Kind.EXPLICIT) {
            throw new IllegalStateException("Identity projection can't hold explicit positions");
        }
        if (size == positions.length) {
            positions = Arrays.copyOf(positions, positions.length * 2);
        }
        positions[size++] = bannerPosition;
    }

    public int project(int tablePosition) {
        switch (kind) {
            case IDENTITY:
                return tablePosition;
            case EXPLICIT:
                if (tablePosition < 0 || tablePosition >= size) {
                    throw new IllegalStateException("Table position " + tablePosition
                        + " outside projection of size " + size);
                }
                return positions[tablePosition];
            default:
                throw new IllegalStateException("Unknown projection kind " + kind);
        }
    }

    @Override
    public String toString() {
        return kind == Kind.IDENTITY
            ? "IndexProjection{IDENTITY}"
            : "IndexProjection{EXPLICIT " + Arrays.toString(Arrays.copyOf(positions, size)) + "}";
    }
}
