package io.datascope;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Connection and pool settings shared by the blocking and non-blocking engines.
 *
 * <p>Values are read once, when an engine is constructed. Changing a setting takes
 * effect after the engine of that mode is disposed and built again.
 *
 * <p>The configured URL is always the blocking form ({@code postgresql://...});
 * the non-blocking engine derives its own URL through {@link io.datascope.url.UriTranslator}.
 *
 * <h2>Property keys</h2>
 * <ul>
 *   <li>{@code datascope.url}</li>
 *   <li>{@code datascope.pool-size}</li>
 *   <li>{@code datascope.max-overflow}</li>
 *   <li>{@code datascope.acquire-timeout-ms}</li>
 *   <li>{@code datascope.pool-recycle-ms}</li>
 *   <li>{@code datascope.n-plus-one.select-threshold}</li>
 * </ul>
 */
public final class DataScopeConfig {
    public static final String DEFAULT_RESOURCE = "datascope.properties";
    public static final String DEFAULT_URL = "h2:///mem:datascope";

    static final String URL_KEY = "datascope.url";
    static final String POOL_SIZE_KEY = "datascope.pool-size";
    static final String MAX_OVERFLOW_KEY = "datascope.max-overflow";
    static final String ACQUIRE_TIMEOUT_KEY = "datascope.acquire-timeout-ms";
    static final String POOL_RECYCLE_KEY = "datascope.pool-recycle-ms";
    static final String SELECT_THRESHOLD_KEY = "datascope.n-plus-one.select-threshold";

    private String url = DEFAULT_URL;
    private int poolSize = 5;
    private int maxOverflow = 10;
    private Duration acquireTimeout = Duration.ofSeconds(30);
    private Duration poolRecycle = Duration.ofMinutes(30);
    private int nPlusOneSelectThreshold = 2;

    /**
     * Builds a config from {@code datascope.*} properties; missing keys keep their defaults.
     *
     * @throws IllegalArgumentException if a numeric value cannot be parsed
     */
    public static DataScopeConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties");
        DataScopeConfig config = new DataScopeConfig();
        String url = properties.getProperty(URL_KEY);
        if (url != null && !url.isBlank()) {
            config.setUrl(url.trim());
        }
        config.setPoolSize(intValue(properties, POOL_SIZE_KEY, config.poolSize));
        config.setMaxOverflow(intValue(properties, MAX_OVERFLOW_KEY, config.maxOverflow));
        config.setAcquireTimeout(Duration.ofMillis(
            longValue(properties, ACQUIRE_TIMEOUT_KEY, config.acquireTimeout.toMillis())));
        config.setPoolRecycle(Duration.ofMillis(
            longValue(properties, POOL_RECYCLE_KEY, config.poolRecycle.toMillis())));
        config.setNPlusOneSelectThreshold(
            intValue(properties, SELECT_THRESHOLD_KEY, config.nPlusOneSelectThreshold));
        return config;
    }

    /**
     * Loads {@value #DEFAULT_RESOURCE} from the classpath (if present) and overlays
     * JVM system properties with the same keys.
     */
    public static DataScopeConfig load() {
        Properties merged = new Properties();
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = DataScopeConfig.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in != null) {
                merged.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + DEFAULT_RESOURCE, e);
        }
        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith("datascope.")) {
                merged.setProperty(key, System.getProperty(key));
            }
        }
        return fromProperties(merged);
    }

    /**
     * Checks value ranges. Called by the registries before building an engine.
     *
     * @throws IllegalArgumentException on the first invalid value
     */
    public DataScopeConfig validate() {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url must not be blank");
        }
        if (poolSize <= 0) {
            throw new IllegalArgumentException("poolSize must be > 0");
        }
        if (maxOverflow < 0) {
            throw new IllegalArgumentException("maxOverflow must be >= 0");
        }
        if (acquireTimeout.isZero() || acquireTimeout.isNegative()) {
            throw new IllegalArgumentException("acquireTimeout must be > 0");
        }
        if (poolRecycle.isZero() || poolRecycle.isNegative()) {
            throw new IllegalArgumentException("poolRecycle must be > 0");
        }
        if (nPlusOneSelectThreshold < 0) {
            throw new IllegalArgumentException("nPlusOneSelectThreshold must be >= 0");
        }
        return this;
    }

    public String getUrl() {
        return url;
    }

    public DataScopeConfig setUrl(String url) {
        this.url = Objects.requireNonNull(url, "url");
        return this;
    }

    public int getPoolSize() {
        return poolSize;
    }

    public DataScopeConfig setPoolSize(int poolSize) {
        this.poolSize = poolSize;
        return this;
    }

    public int getMaxOverflow() {
        return maxOverflow;
    }

    public DataScopeConfig setMaxOverflow(int maxOverflow) {
        this.maxOverflow = maxOverflow;
        return this;
    }

    /**
     * Upper bound on connections a pool may open: {@code poolSize + maxOverflow}.
     */
    public int getMaxPoolSize() {
        return poolSize + maxOverflow;
    }

    public Duration getAcquireTimeout() {
        return acquireTimeout;
    }

    public DataScopeConfig setAcquireTimeout(Duration acquireTimeout) {
        this.acquireTimeout = Objects.requireNonNull(acquireTimeout, "acquireTimeout");
        return this;
    }

    public Duration getPoolRecycle() {
        return poolRecycle;
    }

    public DataScopeConfig setPoolRecycle(Duration poolRecycle) {
        this.poolRecycle = Objects.requireNonNull(poolRecycle, "poolRecycle");
        return this;
    }

    public int getNPlusOneSelectThreshold() {
        return nPlusOneSelectThreshold;
    }

    public DataScopeConfig setNPlusOneSelectThreshold(int nPlusOneSelectThreshold) {
        this.nPlusOneSelectThreshold = nPlusOneSelectThreshold;
        return this;
    }

    private static int intValue(Properties properties, String key, int fallback) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }

    private static long longValue(Properties properties, String key, long fallback) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }
}
