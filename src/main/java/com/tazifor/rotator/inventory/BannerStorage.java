package com.tazifor.rotator.inventory;

import com.tazifor.rotator.model.Banner;
import com.tazifor.rotator.model.LoadResult;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * The {@code BannerStorage} interface is the contract of the banner inventory:
 * a two-phase store that is filled once and then served from concurrently.
 *
 * <h3>Lifecycle</h3>
 * <ol>
 *   <li>Build phase, single thread: {@link #insert} once per banner, then {@link #freeze()}.</li>
 *   <li>Serving phase, any number of threads: {@link #select}. Only each banner's
 *       remaining-impression counter changes from here on.</li>
 * </ol>
 *
 * <h3>Example usage</h3>
 * <pre>{@code
 * BannerStorage storage = new InMemoryBannerStorage();
 * storage.insert("http://a/1.jpg", 2, List.of("x"));
 * storage.freeze();
 * storage.select(List.of("x"));   // Optional[<html>...http://a/1.jpg...]
 * }</pre>
 *
 * @see InMemoryBannerStorage
 */
public interface BannerStorage {

    /**
     * Adds a banner. Build phase only.
     * <p>
     * Rejected records leave the storage untouched.
     * </p>
     *
     * @param url        image URL, non-empty
     * @param total      impressions to serve, positive; also the selection weight
     * @param categories categories the banner is tagged with, non-empty
     * @return the assigned position, or the validation error
     * @throws IllegalStateException if the storage is already frozen
     */
    LoadResult insert(String url, int total, Collection<String> categories);

    /**
     * Picks a banner by weight among those tagged with any of {@code categories}
     * and spends one of its impressions.
     * <p>
     * Empty {@code categories} means the whole inventory.
     * </p>
     *
     * @return the banner markup, or empty when nothing could be shown
     */
    Optional<String> select(Collection<String> categories);

    /**
     * Ends the build phase. Idempotent.
     */
    void freeze();

    boolean isFrozen();

    /**
     * Number of banners loaded.
     */
    int size();

    int categoryCount();

    /**
     * Read-only view of the banners, index = banner position.
     */
    List<Banner> banners();
}
