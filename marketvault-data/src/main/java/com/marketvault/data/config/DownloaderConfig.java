package com.marketvault.data.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Configuration for the downloader.
 * Values come from system properties, then environment variables, then defaults.
 */
public class DownloaderConfig {
    private static final String DEFAULT_DATA_DIR = System.getProperty("user.home") + "/.marketvault";

    private final Path dataDir;
    private final int maxConcurrentDownloads;
    private final int ratePermits;
    private final Duration ratePeriod;
    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Duration pageTimeout;
    private final Duration completenessMargin;

    public DownloaderConfig(Path dataDir, int maxConcurrentDownloads, int ratePermits, Duration ratePeriod,
                            int maxAttempts, Duration initialBackoff, Duration pageTimeout,
                            Duration completenessMargin) {
        if (maxConcurrentDownloads < 1) {
            throw new IllegalArgumentException("maxConcurrentDownloads must be >= 1");
        }
        this.dataDir = dataDir;
        this.maxConcurrentDownloads = maxConcurrentDownloads;
        this.ratePermits = ratePermits;
        this.ratePeriod = ratePeriod;
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.pageTimeout = pageTimeout;
        this.completenessMargin = completenessMargin;
    }

    public static DownloaderConfig load() {
        Path dataDir = Paths.get(setting("marketvault.data.dir", "MARKETVAULT_DATA_DIR", DEFAULT_DATA_DIR));
        int maxDownloads = Integer.parseInt(setting("marketvault.max_downloads", "MARKETVAULT_MAX_DOWNLOADS", "4"));
        int permits = Integer.parseInt(setting("marketvault.rate.permits", "MARKETVAULT_RATE_PERMITS", "100"));
        long periodMs = Long.parseLong(setting("marketvault.rate.period_ms", "MARKETVAULT_RATE_PERIOD_MS", "30000"));
        int attempts = Integer.parseInt(setting("marketvault.retry.max_attempts", "MARKETVAULT_RETRY_MAX_ATTEMPTS", "5"));
        long backoffMs = Long.parseLong(setting("marketvault.retry.backoff_ms", "MARKETVAULT_RETRY_BACKOFF_MS", "500"));
        long timeoutMs = Long.parseLong(setting("marketvault.page.timeout_ms", "MARKETVAULT_PAGE_TIMEOUT_MS", "30000"));
        long marginMs = Long.parseLong(setting("marketvault.complete.margin_ms", "MARKETVAULT_COMPLETE_MARGIN_MS", "60000"));

        return new DownloaderConfig(dataDir, maxDownloads, permits, Duration.ofMillis(periodMs), attempts,
            Duration.ofMillis(backoffMs), Duration.ofMillis(timeoutMs), Duration.ofMillis(marginMs));
    }

    /**
     * Defaults with a custom data directory.
     */
    public static DownloaderConfig withDataDir(Path dataDir) {
        DownloaderConfig base = load();
        return new DownloaderConfig(dataDir, base.maxConcurrentDownloads, base.ratePermits, base.ratePeriod,
            base.maxAttempts, base.initialBackoff, base.pageTimeout, base.completenessMargin);
    }

    private static String setting(String property, String env, String defaultValue) {
        return System.getProperty(property, System.getenv().getOrDefault(env, defaultValue));
    }

    public Path getDataDir() {
        return dataDir;
    }

    public int getMaxConcurrentDownloads() {
        return maxConcurrentDownloads;
    }

    public int getRatePermits() {
        return ratePermits;
    }

    public Duration getRatePeriod() {
        return ratePeriod;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getInitialBackoff() {
        return initialBackoff;
    }

    public Duration getPageTimeout() {
        return pageTimeout;
    }

    /**
     * How long after a partition's end its data is still treated as possibly changing.
     */
    public Duration getCompletenessMargin() {
        return completenessMargin;
    }
}
