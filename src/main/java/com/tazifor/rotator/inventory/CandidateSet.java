package com.tazifor.rotator.inventory;

import java.util.BitSet;
import java.util.stream.IntStream;

/**
 * Outcome of filtering banners by category.
 * <p>
 * Either the {@link #all() ALL} sentinel (no categories requested, draw from the global table)
 * or an explicit set of eligible banner positions, iterated in ascending order.
 * </p>
 */
public final class CandidateSet {

    private static final CandidateSet ALL = new CandidateSet(null);

    private final BitSet positions;

    private CandidateSet(BitSet positions) {
        this.positions = positions;
    }

    public static CandidateSet all() {
        return ALL;
    }

    public static CandidateSet of(BitSet positions) {
        return new CandidateSet((BitSet) positions.clone());
    }

    public boolean isAll() {
        return positions == null;
    }

    /**
     * Eligible positions in ascending order.
     *
     * @throws IllegalStateException on the ALL sentinel
     */
    public IntStream positions() {
        return explicit().stream();
    }

    public int size() {
        return explicit().cardinality();
    }

    public boolean contains(int position) {
        return explicit().get(position);
    }

    private BitSet explicit() {
        if (positions == null) {
            throw new IllegalStateException("ALL candidate set has no explicit positions");
        }
        return positions;
    }

    @Override
    public String toString() {
        return isAll() ? "CandidateSet{ALL}" : "CandidateSet" + positions;
    }
}
