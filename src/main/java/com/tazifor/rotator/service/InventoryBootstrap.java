package com.tazifor.rotator.service;

import com.tazifor.rotator.config.RotatorProperties;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Loads the banner inventory at startup
 *
 * TIMING:
 * Runs while the context is being initialised, before the web server accepts
 * connections, so the build phase never overlaps with serving.
 *
 * CONFIG FILE RESOLUTION:
 * 1. First non-option command line argument (java -jar rotator.jar banners.csv)
 * 2. rotator.config-file
 * 3. None: start with an empty inventory
 *
 * A dash-prefixed positional argument is an option Spring did not recognise
 * (-p/--port are translated by LaunchArguments before Spring sees them) and
 * aborts startup instead of being read as a file name.
 */
@Slf4j
@Component
public class InventoryBootstrap {

    @Autowired
    private RotationService rotationService;

    @Autowired
    private BannerConfigLoader loader;

    @Autowired
    private RotatorProperties properties;

    @Autowired
    private ApplicationArguments arguments;

    @PostConstruct
    public void loadInventory() {
        Path file = resolveConfigFile();

        if (file == null) {
            log.warn("No banner config given (argument or rotator.config-file), starting with an empty inventory");
        } else if (!Files.exists(file)) {
            if (properties.isFailOnMissingFile()) {
                throw new IllegalStateException("Banner config not found: " + file.toAbsolutePath());
            }
            log.warn("Banner config {} not found, starting with an empty inventory", file.toAbsolutePath());
        } else {
            loader.load(file);
        }

        rotationService.completeLoading();
    }

    Path resolveConfigFile() {
        List<String> positional = arguments.getNonOptionArgs();
        if (!positional.isEmpty()) {
            String first = positional.get(0);
            if (first.startsWith("-")) {
                throw new IllegalArgumentException("Unknown option '" + first
                    + "' (expected a banner config file, -p/--port <port> or --server.port=<port>)");
            }
            return Path.of(first);
        }
        String configured = properties.getConfigFile();
        if (configured == null || configured.isBlank()) {
            return null;
        }
        return Path.of(configured);
    }
}
