package com.tazifor.rotator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Banner rotator settings, bound from {@code rotator.*}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "rotator")
public class RotatorProperties {

    /**
     * Banner CSV file. The first non-option command line argument overrides it.
     */
    private String configFile;

    /**
     * Field delimiter of the banner CSV.
     */
    private String delimiter = ";";

    /**
     * Abort startup when the configured file does not exist.
     * When false the service starts with an empty inventory.
     */
    private boolean failOnMissingFile = true;

    /**
     * Fixed seed for the selection draw. Unset = per-thread random.
     */
    private Long randomSeed;
}
