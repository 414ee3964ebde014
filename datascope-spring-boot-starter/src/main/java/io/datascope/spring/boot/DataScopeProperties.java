package io.datascope.spring.boot;

import io.datascope.DataScopeConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the data-access runtime.
 *
 * @see DataScopeAutoConfiguration
 */
@ConfigurationProperties(prefix = "datascope")
public class DataScopeProperties {

    /**
     * Database URL in blocking form, e.g. {@code postgresql://user:pw@host:5432/app}.
     */
    private String url = DataScopeConfig.DEFAULT_URL;

    /**
     * Connections each pool keeps open.
     */
    private int poolSize = 5;

    /**
     * Extra connections a pool may open above {@code pool-size}.
     */
    private int maxOverflow = 10;

    private Duration acquireTimeout = Duration.ofSeconds(30);

    /**
     * Maximum lifetime of a pooled connection.
     */
    private Duration poolRecycle = Duration.ofMinutes(30);

    private final Engine blocking = new Engine();
    private final Engine nonBlocking = new Engine();
    private final NPlusOne nPlusOne = new NPlusOne();
    private final Metrics metrics = new Metrics();

    /**
     * Copies the bound values into a fresh {@link DataScopeConfig}.
     */
    public DataScopeConfig toConfig() {
        return new DataScopeConfig()
            .setUrl(url)
            .setPoolSize(poolSize)
            .setMaxOverflow(maxOverflow)
            .setAcquireTimeout(acquireTimeout)
            .setPoolRecycle(poolRecycle)
            .setNPlusOneSelectThreshold(nPlusOne.getSelectThreshold());
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public int getPoolSize() {
        return poolSize;
    }

    public void setPoolSize(int poolSize) {
        this.poolSize = poolSize;
    }

    public int getMaxOverflow() {
        return maxOverflow;
    }

    public void setMaxOverflow(int maxOverflow) {
        this.maxOverflow = maxOverflow;
    }

    public Duration getAcquireTimeout() {
        return acquireTimeout;
    }

    public void setAcquireTimeout(Duration acquireTimeout) {
        this.acquireTimeout = acquireTimeout;
    }

    public Duration getPoolRecycle() {
        return poolRecycle;
    }

    public void setPoolRecycle(Duration poolRecycle) {
        this.poolRecycle = poolRecycle;
    }

    public Engine getBlocking() {
        return blocking;
    }

    public Engine getNonBlocking() {
        return nonBlocking;
    }

    public NPlusOne getNPlusOne() {
        return nPlusOne;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Engine {
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    public static class NPlusOne {
        /**
         * A capture is flagged when it repeats a pattern and runs more SELECTs than this.
         */
        private int selectThreshold = 2;

        public int getSelectThreshold() {
            return selectThreshold;
        }

        public void setSelectThreshold(int selectThreshold) {
            this.selectThreshold = selectThreshold;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "datascope";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
