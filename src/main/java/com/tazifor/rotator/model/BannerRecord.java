package com.tazifor.rotator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Banner Record
 *
 * One line of the banner configuration, before validation.
 * Values are taken as-is from the source; the store decides whether they are acceptable.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BannerRecord {

    private String url;
    private int total;        // Impressions to serve, must be > 0
    private List<String> categories;
}
