package com.tazifor.rotator.service;

import com.tazifor.rotator.inventory.InMemoryBannerStorage;
import com.tazifor.rotator.model.BannerRecord;
import com.tazifor.rotator.model.InventoryStats;
import com.tazifor.rotator.model.LoadResult;
import com.tazifor.rotator.model.ValidationError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RotationServiceTest {

    private RotationService service;

    @BeforeEach
    void setUp() {
        service = new RotationService();
        ReflectionTestUtils.setField(service, "storage", new InMemoryBannerStorage());
    }

    private static BannerRecord record(String url, int total, String... categories) {
        return BannerRecord.builder().url(url).total(total).categories(List.of(categories)).build();
    }

    @Test
    void loadReportsValidationErrors() {
        LoadResult rejected = service.load(record("http://a/1.jpg", 0, "x"));
        LoadResult loaded = service.load(record("http://a/1.jpg", 1, "x"));

        assertThat(rejected.isSuccess()).isFalse();
        assertThat(rejected.getError()).contains(ValidationError.ILLEGAL_IMPRESSION_AMOUNT);
        assertThat(loaded.isSuccess()).isTrue();
        assertThat(loaded.getPosition()).isZero();
    }

    @Test
    void servesNothingUntilLoadingIsComplete() {
        service.load(record("http://a/1.jpg", 2, "x"));

        assertThat(service.isReady()).isFalse();
        assertThat(service.serve(List.of("x"))).isEmpty();

        service.completeLoading();

        assertThat(service.isReady()).isTrue();
        assertThat(service.serve(List.of("x"))).hasValueSatisfying(m -> assertThat(m).contains("http://a/1.jpg"));
    }

    @Test
    void workedExample() {
        service.load(record("http://a/1.jpg", 2, "x"));
        service.load(record("http://b/1.jpg", 1, "y"));
        service.completeLoading();

        assertThat(service.serve(List.of("x"))).hasValueSatisfying(m -> assertThat(m).contains("http://a/1.jpg"));
        assertThat(service.serve(List.of("x"))).hasValueSatisfying(m -> assertThat(m).contains("http://a/1.jpg"));
        assertThat(service.serve(List.of("x"))).isEmpty();
        assertThat(service.serve(List.of("y"))).hasValueSatisfying(m -> assertThat(m).contains("http://b/1.jpg"));
        assertThat(service.serve(List.of("y"))).isEmpty();
    }

    @Test
    void nullCategoriesServeFromWholeInventory() {
        service.load(record("http://a/1.jpg", 1, "x"));
        service.completeLoading();

        assertThat(service.serve(null)).isPresent();
        assertThat(service.serve(null)).isEmpty();
    }

    @Test
    void statsReflectSpentImpressions() {
        service.load(record("http://a/1.jpg", 2, "x", "shared"));
        service.load(record("http://b/1.jpg", 3, "y", "shared"));
        service.completeLoading();
        service.serve(List.of("x"));

        InventoryStats stats = service.stats();

        assertThat(stats.getBannerCount()).isEqualTo(2);
        assertThat(stats.getCategoryCount()).isEqualTo(3);
        assertThat(stats.isFrozen()).isTrue();
        assertThat(stats.getDeclaredImpressions()).isEqualTo(5);
        assertThat(stats.getRemainingImpressions()).isEqualTo(4);
        assertThat(stats.getBanners()).extracting(InventoryStats.BannerStats::getRemaining).containsExactly(1, 3);
        assertThat(stats.getBanners().get(1).getUrl()).isEqualTo("http://b/1.jpg");
    }
}
