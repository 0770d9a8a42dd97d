package com.pagelens.core.util;

import com.pagelens.core.model.ExtractorConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class YamlConfigLoaderTest {

    @TempDir
    Path tmp;

    private static InputStream yaml(String s) {
        return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void values_are_applied_on_top_of_defaults() {
        ExtractorConfig cfg = YamlConfigLoader.load(yaml("""
                userAgent: "TestAgent/1.0"
                pageTimeoutMs: 3000
                followRedirects: false
                maxColors: 12
                phoneDefaultRegion: kr
                robots:
                  fetch: false
                  cacheTtlMinutes: 5
                """));

        assertThat(cfg.getUserAgent()).isEqualTo("TestAgent/1.0");
        assertThat(cfg.getPageTimeout()).isEqualTo(Duration.ofSeconds(3));
        assertThat(cfg.isFollowRedirects()).isFalse();
        assertThat(cfg.getFetchAttempts()).isEqualTo(2);
        assertThat(cfg.getMaxColors()).isEqualTo(12);
        assertThat(cfg.getPhoneDefaultRegion()).isEqualTo("KR");
        assertThat(cfg.getRobots().isFetch()).isFalse();
        assertThat(cfg.getRobots().getTimeoutMs()).isEqualTo(5000);
        assertThat(cfg.getRobots().getCacheTtlMinutes()).isEqualTo(5);
    }

    @Test
    void out_of_range_max_colors_is_clamped() {
        assertThat(YamlConfigLoader.load(yaml("maxColors: 500")).getMaxColors()).isEqualTo(50);
        assertThat(YamlConfigLoader.load(yaml("maxColors: 0")).getMaxColors()).isEqualTo(1);
    }

    @Test
    void empty_document_yields_defaults() {
        ExtractorConfig cfg = YamlConfigLoader.load(yaml(""));
        assertThat(cfg.getMaxColors()).isEqualTo(ExtractorConfig.MAX_COLORS_LIMIT);
        assertThat(cfg.getRobots().isFetch()).isTrue();
    }

    @Test
    void invalid_values_fail_validation() {
        assertThatThrownBy(() -> YamlConfigLoader.load(yaml("fetchAttempts: 0")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("fetchAttempts");
        assertThatThrownBy(() -> YamlConfigLoader.load(yaml("phoneDefaultRegion: USA")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void load_from_path() throws IOException {
        Path file = tmp.resolve("pagelens.yml");
        Files.writeString(file, "fetchAttempts: 4\n");
        assertThat(YamlConfigLoader.load(file).getFetchAttempts()).isEqualTo(4);
    }

    @Test
    void missing_path_is_io_error() {
        assertThatThrownBy(() -> YamlConfigLoader.load(tmp.resolve("nope.yml")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void default_resource_is_on_classpath() throws IOException {
        ExtractorConfig cfg = YamlConfigLoader.loadDefault();
        assertThat(cfg.getUserAgent()).startsWith("PageLens/");
        assertThat(cfg.getRobots().getCacheTtlMinutes()).isEqualTo(30);
    }
}
