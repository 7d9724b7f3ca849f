package com.nutrilog.backend.prediction.session;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.prediction.session")
public class PredictionSessionProperties {

    /** Idle time after which a user's session is dropped (next read starts a new one). */
    private Duration ttl = Duration.ofMinutes(30);

    /** Upper bound of live sessions kept in memory. */
    private long maxSize = 10_000;

    /** Threads used for recent-log fetches. */
    private int fetchPoolSize = 4;

    private int fetchQueueCapacity = 500;

    public Duration getTtl() { return ttl; }
    public void setTtl(Duration ttl) { this.ttl = ttl; }

    public long getMaxSize() { return maxSize; }
    public void setMaxSize(long maxSize) { this.maxSize = maxSize; }

    public int getFetchPoolSize() { return fetchPoolSize; }
    public void setFetchPoolSize(int fetchPoolSize) { this.fetchPoolSize = fetchPoolSize; }

    public int getFetchQueueCapacity() { return fetchQueueCapacity; }
    public void setFetchQueueCapacity(int fetchQueueCapacity) { this.fetchQueueCapacity = fetchQueueCapacity; }
}
