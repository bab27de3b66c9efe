package com.marketvault.data.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class DownloaderConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty("marketvault.max_downloads");
        System.clearProperty("marketvault.rate.permits");
        System.clearProperty("marketvault.complete.margin_ms");
    }

    @Test
    @DisplayName("System properties override defaults")
    void systemPropertiesOverride() {
        System.setProperty("marketvault.max_downloads", "7");
        System.setProperty("marketvault.rate.permits", "20");
        System.setProperty("marketvault.complete.margin_ms", "1500");

        DownloaderConfig config = DownloaderConfig.load();

        assertEquals(7, config.getMaxConcurrentDownloads());
        assertEquals(20, config.getRatePermits());
        assertEquals(Duration.ofMillis(1500), config.getCompletenessMargin());
    }

    @Test
    @DisplayName("Data dir can be replaced while keeping other settings")
    void withDataDir() {
        Path dir = Paths.get("/tmp/vault-test");

        DownloaderConfig config = DownloaderConfig.withDataDir(dir);

        assertEquals(dir, config.getDataDir());
        assertTrue(config.getMaxAttempts() >= 1);
    }

    @Test
    @DisplayName("At least one worker is required")
    void rejectsZeroWorkers() {
        assertThrows(IllegalArgumentException.class, () -> new DownloaderConfig(Paths.get("x"), 0, 1,
            Duration.ofSeconds(1), 1, Duration.ZERO, Duration.ZERO, Duration.ZERO));
    }
}
