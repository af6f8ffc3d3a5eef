package com.tazifor.rotator.service;

import com.tazifor.rotator.inventory.BannerStorage;
import com.tazifor.rotator.model.Banner;
import com.tazifor.rotator.model.BannerRecord;
import com.tazifor.rotator.model.InventoryStats;
import com.tazifor.rotator.model.LoadResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * RotationService - Banner Serving Facade
 *
 * The two operations the rest of the application talks to:
 * - load(record): build phase, once per configured banner
 * - serve(categories): serving phase, once per request
 *
 * LIFECYCLE:
 * load() ... load() -> completeLoading() -> serve() from any number of threads
 *
 * serve() before completeLoading() returns empty: the storage is not safe to read
 * while it is still being built.
 */
@Slf4j
@Service
public class RotationService {

    @Autowired
    private BannerStorage storage;

    /**
     * Add one banner to the inventory
     *
     * A rejected record is reported through the result and changes nothing;
     * callers carry on with the next record.
     */
    public LoadResult load(BannerRecord record) {
        LoadResult result = storage.insert(record.getUrl(), record.getTotal(), record.getCategories());
        if (result.isSuccess()) {
            log.debug("Loaded banner #{} {} ({} impressions, categories {})",
                result.getPosition(), record.getUrl(), record.getTotal(), record.getCategories());
        }
        return result;
    }

    /**
     * End of the build phase: freeze the inventory and open it for serving.
     */
    public void completeLoading() {
        storage.freeze();
        log.info("Inventory frozen: {} banners, {} categories", storage.size(), storage.categoryCount());
    }

    public boolean isReady() {
        return storage.isFrozen();
    }

    /**
     * Serve one impression
     *
     * EMPTY RESULT IS NORMAL:
     * - no banner carries any of the categories
     * - every matching banner is exhausted
     * - the picked banner was exhausted by a concurrent request in between
     *
     * @param categories requested categories, empty = whole inventory
     * @return banner markup, or empty when there is nothing to show
     */
    public Optional<String> serve(List<String> categories) {
        if (!storage.isFrozen()) {
            log.debug("Serve requested while inventory is still loading");
            return Optional.empty();
        }

        List<String> requested = categories == null ? List.of() : categories;
        Optional<String> markup = storage.select(requested);

        if (log.isDebugEnabled()) {
            log.debug("Serve {} -> {}", requested, markup.isPresent() ? "shown" : "nothing to show");
        }
        return markup;
    }

    /**
     * Inventory statistics for monitoring
     *
     * NOT IN HOT PATH: walks every banner
     */
    public InventoryStats stats() {
        List<Banner> banners = storage.banners();
        List<InventoryStats.BannerStats> perBanner = new ArrayList<>(banners.size());
        long declared = 0;
        long remaining = 0;

        for (int position = 0; position < banners.size(); position++) {
            Banner banner = banners.get(position);
            int left = banner.getRemaining();
            declared += banner.getTotal();
            remaining += left;
            perBanner.add(InventoryStats.BannerStats.builder()
                .position(position)
                .url(banner.getUrl())
                .total(banner.getTotal())
                .remaining(left)
                .build());
        }

        return InventoryStats.builder()
            .bannerCount(banners.size())
            .categoryCount(storage.categoryCount())
            .frozen(storage.isFrozen())
            .declaredImpressions(declared)
            .remainingImpressions(remaining)
            .banners(perBanner)
            .build();
    }
}
