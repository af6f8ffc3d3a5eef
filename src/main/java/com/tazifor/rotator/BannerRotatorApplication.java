package com.tazifor.rotator;

import com.tazifor.rotator.config.LaunchArguments;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Banner Rotator - In-Memory Banner Serving
 *
 * Serves banner impressions under per-banner impression budgets:
 * - Weighted random pick, probability proportional to the declared budget
 * - Category filtering through a prebuilt index
 * - Lock-free budget depletion, never over-serves under concurrency
 *
 * Usage: java -jar banner-rotator.jar banners.csv --server.port=8080
 *        java -jar banner-rotator.jar -p 8080 banners.csv
 */
@SpringBootApplication
public class BannerRotatorApplication {

    public static void main(String[] args) {
        printBanner();
        SpringApplication.run(BannerRotatorApplication.class, LaunchArguments.toSpringArguments(args));
    }

    private static void printBanner() {
        System.out.println("""
            ╔════════════════════════════════════════════════════════╗
            ║                                                        ║
            ║                   BANNER ROTATOR                       ║
            ║         Weighted Impressions, Budgeted Serving         ║
            ║                                                        ║
            ╚════════════════════════════════════════════════════════╝

            Starting Banner Rotator...
            """);
    }
}
