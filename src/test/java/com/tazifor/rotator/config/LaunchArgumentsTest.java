package com.tazifor.rotator.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LaunchArgumentsTest {

    @Test
    void shortAndLongPortOptionsBecomeServerPort() {
        assertThat(LaunchArguments.toSpringArguments(new String[]{"-p", "9090", "banners.csv"}))
            .containsExactly("--server.port=9090", "banners.csv");
        assertThat(LaunchArguments.toSpringArguments(new String[]{"banners.csv", "--port", "9091"}))
            .containsExactly("banners.csv", "--server.port=9091");
        assertThat(LaunchArguments.toSpringArguments(new String[]{"--port=9092"}))
            .containsExactly("--server.port=9092");
    }

    @Test
    void springPropertiesPassThrough() {
        assertThat(LaunchArguments.toSpringArguments(new String[]{"banners.csv", "--server.port=8081", "--rotator.delimiter=|"}))
            .containsExactly("banners.csv", "--server.port=8081", "--rotator.delimiter=|");
        assertThat(LaunchArguments.toSpringArguments(new String[0])).isEmpty();
    }

    @Test
    void configFileStaysFirstPositionalAfterTranslation() {
        DefaultApplicationArguments arguments = new DefaultApplicationArguments(
            LaunchArguments.toSpringArguments(new String[]{"-p", "9090", "banners.csv"}));

        assertThat(arguments.getNonOptionArgs()).containsExactly("banners.csv");
        assertThat(arguments.getOptionValues("server.port")).containsExactly("9090");
    }

    @Test
    void portOptionWithoutValueIsRejected() {
        assertThatThrownBy(() -> LaunchArguments.toSpringArguments(new String[]{"-p"}))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("-p");
        assertThatThrownBy(() -> LaunchArguments.toSpringArguments(new String[]{"--port", "--server.port=1"}))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
