package com.tazifor.rotator.inventory;

import com.tazifor.rotator.model.Banner;
import com.tazifor.rotator.model.LoadResult;
import com.tazifor.rotator.model.ValidationError;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;
import java.util.random.RandomGenerator;

/**
 * InMemoryBannerStorage - Weighted Banner Rotation
 *
 * STRUCTURE:
 * - banners: append-only list, position = permanent banner identity
 * - index: category -> positions (frozen after load)
 * - globalWeights: prefix sums of every banner's total (frozen after load)
 *
 * SELECTION FLOW:
 * No categories:   global table -> draw -> deplete
 * With categories: index union -> drop exhausted -> ephemeral table -> draw -> deplete
 *                                 ↑ snapshot, not locked                    ↑ authoritative (CAS)
 *
 * RACE CONDITION WARNING:
 * The exhausted-filter and the depletion are two separate steps. Two requests can both
 * see a banner with 1 impression left as eligible; exactly one of them gets it, the other
 * gets empty even though a candidate existed when it started. There is no retry.
 *
 * WEIGHTS:
 * Selection weight is always the declared total, never the remaining count.
 * A depleted banner keeps its share of the global table and simply fails to show.
 *
 * THREAD SAFETY:
 * insert() and freeze() belong to the single-threaded build phase. Publish the instance to
 * other threads only after freeze(); select() is then lock-free.
 */
public class InMemoryBannerStorage implements BannerStorage {

    private final List<Banner> banners = new ArrayList<>();
    private final CategoryIndex index = new CategoryIndex();
    private final CumulativeWeights globalWeights = CumulativeWeights.identity();
    private final Supplier<? extends RandomGenerator> random;

    private volatile boolean frozen;

    public InMemoryBannerStorage() {
        this(ThreadLocalRandom::current);
    }

    /**
     * @param random source of the uniform draw; a fixed-seed generator makes selection reproducible
     */
    public InMemoryBannerStorage(Supplier<? extends RandomGenerator> random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    public LoadResult insert(String url, int total, Collection<String> categories) {
        if (frozen) {
            throw new IllegalStateException("Storage is frozen, banners can only be added while loading");
        }

        // VALIDATE first, mutate nothing on rejection
        if (url == null || url.isEmpty()) {
            return LoadResult.rejected(ValidationError.ILLEGAL_URL);
        }
        if (total <= 0) {
            return LoadResult.rejected(ValidationError.ILLEGAL_IMPRESSION_AMOUNT);
        }
        Set<String> distinctCategories = distinct(categories);
        if (distinctCategories.isEmpty()) {
            return LoadResult.rejected(ValidationError.EMPTY_CATEGORIES);
        }

        int position = banners.size();
        banners.add(new Banner(url, total));
        for (String category : distinctCategories) {
            index.add(category, position);
        }
        globalWeights.addWeight(total);

        return LoadResult.loaded(position);
    }

    @Override
    public Optional<String> select(Collection<String> categories) {
        CandidateSet candidates = filter(categories);

        CumulativeWeights weights;
        if (candidates.isAll()) {
            weights = globalWeights;
        } else {
            weights = weightsOf(candidates);
        }

        OptionalInt winner = weights.select(random.get());
        if (winner.isEmpty()) {
            return Optional.empty();
        }
        return bannerAt(winner.getAsInt()).show();
    }

    /**
     * Eligible banners for {@code categories}
     *
     * EMPTY INPUT: returns the ALL sentinel (use the global table), not an error.
     * OTHERWISE: union of the index lists of the known categories, minus banners that
     * read as exhausted right now. The exhausted check is a snapshot (see class docs).
     */
    public CandidateSet filter(Collection<String> categories) {
        if (categories == null || categories.isEmpty()) {
            return CandidateSet.all();
        }

        BitSet eligible = index.union(categories);
        for (int p = eligible.nextSetBit(0); p >= 0; p = eligible.nextSetBit(p + 1)) {
            if (!bannerAt(p).canShow()) {
                eligible.clear(p);
            }
        }
        return CandidateSet.of(eligible);
    }

    /**
     * Ephemeral table over the candidates, ascending position order, weight = declared total.
     * Never cached: the eligible subset changes from call to call.
     */
    CumulativeWeights weightsOf(CandidateSet candidates) {
        CumulativeWeights weights = CumulativeWeights.withProjection(candidates.size());
        candidates.positions().forEach(p -> weights.addWeight(bannerAt(p).getTotal(), p));
        return weights;
    }

    @Override
    public void freeze() {
        index.freeze();
        frozen = true;
    }

    @Override
    public boolean isFrozen() {
        return frozen;
    }

    @Override
    public int size() {
        return banners.size();
    }

    @Override
    public int categoryCount() {
        return index.categoryCount();
    }

    @Override
    public List<Banner> banners() {
        return Collections.unmodifiableList(banners);
    }

    CumulativeWeights globalWeights() {
        return globalWeights;
    }

    /**
     * Fails fast: an index or table pointing outside the banner list means the
     * append-only contract was broken.
     */
    private Banner bannerAt(int position) {
        if (position < 0 || position >= banners.size()) {
            throw new IllegalStateException("Index references unknown banner position " + position
                + " (banners loaded: " + banners.size() + ")");
        }
        return banners.get(position);
    }

    private static Set<String> distinct(Collection<String> categories) {
        Set<String> result = new LinkedHashSet<>();
        if (categories == null) {
            return result;
        }
        for (String category : categories) {
            if (category != null) {
                result.add(category);
            }
        }
        return result;
    }
}
