package dev.nuclr.processexecuter.config;

import java.io.InputStream;
import java.time.Duration;
import java.util.Properties;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Library configuration loaded from {@code process-executer.properties} on the classpath.
 * All fields are read-only after construction; fall back to safe defaults if the file is absent.
 */
@Slf4j
@Getter
public final class ProcessExecuterConfig {

    private static final String PROPS_RESOURCE = "process-executer.properties";

    private static volatile ProcessExecuterConfig defaultConfig;

    /** Bytes read from a monitored pipe per iteration of its monitor loop. */
    private final int chunkSize;

    /** Upper bound, in milliseconds, of one wait for pipe data to become readable. */
    private final long pollIntervalMillis;

    /** Permission bits of files created by path destinations that do not name their own. */
    private final int defaultFilePermissions;

    /** Milliseconds to wait for output pumps to finish once a timed-out process was killed. */
    private final long drainTimeoutMillis;

    public ProcessExecuterConfig() {
        this(loadProps());
    }

    ProcessExecuterConfig(Properties p) {
        chunkSize              = (int) positive("chunkSize", parseInt(p, "chunkSize", 100_000), 100_000);
        pollIntervalMillis     = positive("pollIntervalMillis", parseLong(p, "pollIntervalMillis", 1), 1);
        defaultFilePermissions = parseOctal(p, "defaultFilePermissions", 0644);
        drainTimeoutMillis     = positive("drainTimeoutMillis", parseLong(p, "drainTimeoutMillis", 500), 500);
    }

    /** Returns the shared configuration, loading it on first use. */
    public static ProcessExecuterConfig getDefault() {
        ProcessExecuterConfig config = defaultConfig;
        if (config == null) {
            synchronized (ProcessExecuterConfig.class) {
                config = defaultConfig;
                if (config == null) {
                    config = new ProcessExecuterConfig();
                    defaultConfig = config;
                }
            }
        }
        return config;
    }

    public Duration getPollInterval() {
        return Duration.ofMillis(pollIntervalMillis);
    }

    public Duration getDrainTimeout() {
        return Duration.ofMillis(drainTimeoutMillis);
    }

    private static Properties loadProps() {
        Properties p = new Properties();
        try (InputStream in = ProcessExecuterConfig.class
                .getClassLoader()
                .getResourceAsStream(PROPS_RESOURCE)) {
            if (in != null) {
                p.load(in);
            } else {
                log.debug("{} not found on classpath, using built-in defaults", PROPS_RESOURCE);
            }
        } catch (Exception e) {
            log.warn("Could not load {}: {}", PROPS_RESOURCE, e.getMessage());
        }
        return p;
    }

    private static int parseInt(Properties p, String key, int def) {
        try {
            return Integer.parseInt(p.getProperty(key, String.valueOf(def)).trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid value for {}, using default {}", key, def);
            return def;
        }
    }

    private static long parseLong(Properties p, String key, long def) {
        try {
            return Long.parseLong(p.getProperty(key, String.valueOf(def)).trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid value for {}, using default {}", key, def);
            return def;
        }
    }

    private static int parseOctal(Properties p, String key, int def) {
        String raw = p.getProperty(key, Integer.toOctalString(def)).trim();
        try {
            int value = Integer.parseInt(raw, 8);
            if (value < 0 || value > 0777) {
                log.warn("{} out of range ({}), using default {}", key, raw, Integer.toOctalString(def));
                return def;
            }
            return value;
        } catch (NumberFormatException e) {
            log.warn("Invalid value for {}, using default {}", key, Integer.toOctalString(def));
            return def;
        }
    }

    private static long positive(String key, long value, long def) {
        if (value <= 0) {
            log.warn("{} must be positive, using default {}", key, def);
            return def;
        }
        return value;
    }
}
