package com.tazifor.rotator.inventory;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CategoryIndexTest {

    @Test
    void keepsLoadOrderPerCategory() {
        CategoryIndex index = new CategoryIndex();
        index.add("x", 3);
        index.add("x", 0);
        index.add("y", 1);

        assertThat(index.positionsOf("x")).containsExactly(3, 0);
        assertThat(index.positionsOf("y")).containsExactly(1);
        assertThat(index.positionsOf("nope")).isEmpty();
        assertThat(index.categoryCount()).isEqualTo(2);
    }

    @Test
    void unionDeduplicatesAndIgnoresUnknownKeys() {
        CategoryIndex index = new CategoryIndex();
        index.add("x", 0);
        index.add("x", 2);
        index.add("y", 2);
        index.add("y", 5);

        assertThat(index.union(List.of("x", "y", "unknown")).stream().toArray()).containsExactly(0, 2, 5);
        assertThat(index.union(Arrays.asList("unknown", null)).isEmpty()).isTrue();
    }

    @Test
    void frozenIndexRejectsAdditionsAndStaysReadable() {
        CategoryIndex index = new CategoryIndex();
        index.add("x", 0);
        index.freeze();
        index.freeze();

        assertThat(index.isFrozen()).isTrue();
        assertThatThrownBy(() -> index.add("x", 1)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> index.positionsOf("x").add(7)).isInstanceOf(UnsupportedOperationException.class);
        assertThat(index.positionsOf("x")).containsExactly(0);
    }
}
