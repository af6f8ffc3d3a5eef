package com.tazifor.rotator.inventory;

import java.util.Arrays;
import java.util.OptionalInt;
import java.util.random.RandomGenerator;

/**
 * Weighted random pick over prefix sums.
 * <p>
 * Weights are appended one at a time; the table keeps the running prefix sums
 * {@code sums[i] = w0 + ... + wi}, strictly increasing because every weight is positive.
 * A draw takes a uniform {@code r} in {@code [0, W]} (W = last prefix sum, bound inclusive)
 * and binary-searches the smallest position whose prefix sum is {@code >= r}.
 * The hit position goes through the {@link IndexProjection} to become a banner position.
 * </p>
 *
 * <h3>Example</h3>
 * <pre>{@code
 * CumulativeWeights weights = CumulativeWeights.withProjection(2);
 * weights.addWeight(10, 4);   // banner #4, weight 10 -> sums [10]
 * weights.addWeight(30, 7);   // banner #7, weight 30 -> sums [10, 40]
 * weights.select(random);     // 4 or 7, roughly 1:3
 * }</pre>
 *
 * Not thread-safe while being built. Once fully built, {@link #select} only reads
 * and may be called from any number of threads.
 */
public final class CumulativeWeights {

    private static final int DEFAULT_CAPACITY = 16;

    private long[] sums;
    private int size;
    private final IndexProjection projection;

    private CumulativeWeights(IndexProjection projection, int capacity) {
        this.projection = projection;
        this.sums = new long[Math.max(capacity, 1)];
    }

    /**
     * Table over every banner, table position = banner position.
     */
    public static CumulativeWeights identity() {
        return new CumulativeWeights(IndexProjection.identity(), DEFAULT_CAPACITY);
    }

    /**
     * Table over an explicit subset of banners.
     */
    public static CumulativeWeights withProjection(int expectedSize) {
        return new CumulativeWeights(IndexProjection.explicit(expectedSize),
            expectedSize > 0 ? expectedSize : DEFAULT_CAPACITY);
    }

    /**
     * Appends the weight of the next banner of an identity table.
     */
    public void addWeight(int weight) {
        if (projection.kind() != IndexProjection.Kind.IDENTITY) {
            throw new IllegalStateException("Can't add weight without index projection");
        }
        push(weight);
    }

    /**
     * Appends the weight of banner {@code bannerPosition} to an explicit table.
     */
    public void addWeight(int weight, int bannerPosition) {
        if (projection.kind() != IndexProjection.Kind.EXPLICIT) {
            throw new IllegalStateException("Can't add projection to identity table");
        }
        checkWeight(weight);
        projection.append(bannerPosition);
        push(weight);
    }

    /**
     * Draws one banner position with probability proportional to its weight.
     *
     * @param random uniform source, only consulted when the table has 2+ entries
     * @return the picked banner position, empty for an empty table
     */
    public OptionalInt select(RandomGenerator random) {
        if (size == 0) {
            return OptionalInt.empty();
        }
        if (size == 1) {
            return OptionalInt.of(projection.project(0));
        }

        long r = random.nextLong(totalWeight() + 1);
        int idx = Arrays.binarySearch(sums, 0, size, r);
        if (idx < 0) {
            idx = -idx - 1; // insertion point = first prefix sum greater than r
        }
        return OptionalInt.of(projection.project(idx));
    }

    public int size() { return size; }

    public boolean isEmpty() { return size == 0; }

    /**
     * Sum of all weights, 0 for an empty table.
     */
    public long totalWeight() {
        return size == 0 ? 0 : sums[size - 1];
    }

    public IndexProjection projection() { return projection; }

    /**
     * Prefix sum at a table position.
     */
    long prefixSum(int tablePosition) {
        if (tablePosition < 0 || tablePosition >= size) {
            throw new IndexOutOfBoundsException("Table position " + tablePosition + ", size " + size);
        }
        return sums[tablePosition];
    }

    private void push(int weight) {
        checkWeight(weight);
        if (size == sums.length) {
            sums = Arrays.copyOf(sums, sums.length * 2);
        }
        sums[size] = totalWeight() + weight;
        size++;
    }

    private static void checkWeight(int weight) {
        if (weight <= 0) {
            throw new IllegalArgumentException("Weight must be positive: " + weight);
        }
    }
}
