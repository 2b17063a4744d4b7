package io.practicedb.core.sync;

import java.time.Duration;
import java.util.List;

import io.practicedb.core.PracticeCollections;

/**
 * Settings for {@link SyncManager}. Build with {@link #builder()}.
 */
public class SyncConfig {
    public static final Duration DEFAULT_INTERVAL = Duration.ofMinutes(5);
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    private final boolean enabled;
    private final String endpoint;
    private final String apiKey;
    private final Duration syncInterval;
    private final List<String> collections;
    private final ConflictResolution conflictResolution;
    private final Duration requestTimeout;

    private SyncConfig(Builder builder) {
        this.enabled = builder.enabled;
        this.endpoint = trimTrailingSlash(builder.endpoint);
        this.apiKey = builder.apiKey;
        this.syncInterval = builder.syncInterval;
        this.collections = List.copyOf(builder.collections);
        this.conflictResolution = builder.conflictResolution;
        this.requestTimeout = builder.requestTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static SyncConfig disabled() {
        return builder().build();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public boolean hasEndpoint() {
        return endpoint != null && !endpoint.isBlank();
    }

    public String getApiKey() {
        return apiKey;
    }

    public Duration getSyncInterval() {
        return syncInterval;
    }

    public List<String> getCollections() {
        return collections;
    }

    public ConflictResolution getConflictResolution() {
        return conflictResolution;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    private static String trimTrailingSlash(String url) {
        if (url == null) {
            return null;
        }
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    public static final class Builder {
        private boolean enabled;
        private String endpoint;
        private String apiKey;
        private Duration syncInterval = DEFAULT_INTERVAL;
        private List<String> collections = PracticeCollections.ALL;
        private ConflictResolution conflictResolution = ConflictResolution.NEWEST_WINS;
        private Duration requestTimeout = DEFAULT_TIMEOUT;

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder endpoint(String endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder syncInterval(Duration syncInterval) {
            this.syncInterval = syncInterval;
            return this;
        }

        public Builder collections(List<String> collections) {
            this.collections = collections;
            return this;
        }

        public Builder conflictResolution(ConflictResolution conflictResolution) {
            this.conflictResolution = conflictResolution;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public SyncConfig build() {
            return new SyncConfig(this);
        }
    }
}
