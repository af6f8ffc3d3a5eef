package com.tazifor.rotator.inventory;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Category key -> banner positions tagged with it, in load order.
 * <p>
 * Built once while banners are loaded, then {@link #freeze() frozen}. After freezing
 * the index is read-only and needs no locking.
 * </p>
 */
public final class CategoryIndex {

    private Map<String, List<Integer>> positionsByCategory = new HashMap<>();
    private volatile boolean frozen;

    /**
     * Tags banner {@code position} with {@code category}.
     *
     * @throws IllegalStateException once the index is frozen
     */
    public void add(String category, int position) {
        if (frozen) {
            throw new IllegalStateException("Category index is frozen");
        }
        positionsByCategory.computeIfAbsent(category, c -> new ArrayList<>()).add(position);
    }

    /**
     * Makes the index read-only. Idempotent.
     */
    public void freeze() {
        if (frozen) {
            return;
        }
        Map<String, List<Integer>> copy = new HashMap<>(positionsByCategory.size() * 2);
        positionsByCategory.forEach((category, positions) -> copy.put(category, List.copyOf(positions)));
        positionsByCategory = Map.copyOf(copy);
        frozen = true;
    }

    public boolean isFrozen() { return frozen; }

    /**
     * Positions tagged with {@code category}, in load order. Unknown category -> empty list.
     */
    public List<Integer> positionsOf(String category) {
        List<Integer> positions = positionsByCategory.get(category);
        return positions == null ? List.of() : positions;
    }

    /**
     * Union of the positions of every known category, deduplicated.
     * Unknown keys contribute nothing.
     */
    public BitSet union(Collection<String> categories) {
        BitSet result = new BitSet();
        for (String category : categories) {
            if (category == null) {
                continue;
            }
            for (int position : positionsOf(category)) {
                result.set(position);
            }
        }
        return result;
    }

    public int categoryCount() {
        return positionsByCategory.size();
    }
}
