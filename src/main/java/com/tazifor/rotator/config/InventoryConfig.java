package com.tazifor.rotator.config;

import com.tazifor.rotator.inventory.BannerStorage;
import com.tazifor.rotator.inventory.InMemoryBannerStorage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Random;

/**
 * Inventory Configuration for the Banner Rotator
 *
 * One storage instance per application, shared by every request thread.
 * It is filled and frozen by {@link com.tazifor.rotator.service.InventoryBootstrap}
 * before the web server accepts connections.
 */
@Slf4j
@Configuration
public class InventoryConfig {

    @Bean
    public BannerStorage bannerStorage(RotatorProperties properties) {
        Long seed = properties.getRandomSeed();
        if (seed == null) {
            return new InMemoryBannerStorage();
        }

        // java.util.Random is thread-safe, one shared instance keeps the sequence reproducible
        Random seeded = new Random(seed);
        log.info("Banner selection uses fixed random seed {}", seed);
        return new InMemoryBannerStorage(() -> seeded);
    }
}
