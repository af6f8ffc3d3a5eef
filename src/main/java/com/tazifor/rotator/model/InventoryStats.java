package com.tazifor.rotator.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Inventory Statistics DTO
 *
 * USED FOR: Monitoring, debugging
 * NOT ATOMIC: each banner's remaining count is read independently
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InventoryStats {

    private int bannerCount;
    private int categoryCount;
    private boolean frozen;

    @JsonProperty("totalImpressions")
    private long declaredImpressions;

    private long remainingImpressions;

    private List<BannerStats> banners;

    /**
     * Per-banner view
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BannerStats {
        private int position;
        private String url;
        private int total;
        private int remaining;
    }
}
