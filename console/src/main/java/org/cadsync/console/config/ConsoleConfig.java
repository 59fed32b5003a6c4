package org.cadsync.console.config;

import io.github.cdimascio.dotenv.Dotenv;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/**
 * Immutable configuration for the dispatch console.
 * Values come from environment variables, then a {@code .env} file, then defaults.
 */
public final class ConsoleConfig {

    private static final Logger LOG = Logger.getLogger(ConsoleConfig.class.getName());

    public static final String DEFAULT_API_URL = "http://localhost:8081/";
    public static final String DEFAULT_REALTIME_PATH = "api/cad/live";
    public static final String DEFAULT_HEALTH_PATH = "api/health";
    public static final int DEFAULT_REFRESH_INTERVAL = 30;
    public static final long DEFAULT_RECONNECT_DELAY_MS = 1_000L;
    public static final long DEFAULT_MAX_RECONNECT_DELAY_MS = 30_000L;
    public static final int DEFAULT_PROBE_INTERVAL = 5;
    public static final int DEFAULT_CONNECT_TIMEOUT = 10;
    public static final int DEFAULT_READ_TIMEOUT = 30;
    public static final String DEFAULT_LOG_FILE = "logs/cad-console.log";

    // API
    private final String apiBaseUrl;
    private final String realtimeUrl;
    private final String healthPath;
    private final String channelUnit;
    private final int connectTimeoutSeconds;
    private final int readTimeoutSeconds;

    // Refresh and reconnect
    private final int refreshIntervalSeconds;
    private final boolean pollingEnabled;
    private final long reconnectDelayMillis;
    private final long maxReconnectDelayMillis;
    private final int probeIntervalSeconds;

    // Offline queue
    private final Path queueFile;

    // Logging
    private final String logFilePath;
    private final boolean fileLoggingEnabled;

    private ConsoleConfig(Builder builder) {
        this.apiBaseUrl = builder.apiBaseUrl;
        this.realtimeUrl = builder.realtimeUrl != null ? builder.realtimeUrl : deriveRealtimeUrl(builder.apiBaseUrl);
        this.healthPath = builder.healthPath;
        this.channelUnit = builder.channelUnit;
        this.connectTimeoutSeconds = builder.connectTimeoutSeconds;
        this.readTimeoutSeconds = builder.readTimeoutSeconds;
        this.refreshIntervalSeconds = builder.refreshIntervalSeconds;
        this.pollingEnabled = builder.pollingEnabled;
        this.reconnectDelayMillis = builder.reconnectDelayMillis;
        this.maxReconnectDelayMillis = builder.maxReconnectDelayMillis;
        this.probeIntervalSeconds = builder.probeIntervalSeconds;
        this.queueFile = builder.queueFile;
        this.logFilePath = builder.logFilePath;
        this.fileLoggingEnabled = builder.fileLoggingEnabled;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates configuration from environment variables, falling back to a {@code .env} file in the
     * working directory or its parent.
     */
    public static ConsoleConfig fromEnvironment() {
        Dotenv local = Dotenv.configure().ignoreIfMissing().load();
        Dotenv parent = Dotenv.configure().directory("../").ignoreIfMissing().load();
        return fromSource(key -> firstNonBlank(System.getenv(key), local.get(key, null), parent.get(key, null)));
    }

    /**
     * Creates configuration from an arbitrary key lookup; missing or blank keys take defaults.
     */
    public static ConsoleConfig fromSource(UnaryOperator<String> source) {
        Objects.requireNonNull(source, "source must not be null");
        Builder builder = new Builder()
                .apiBaseUrl(getString(source, "CAD_API_BASE_URL", DEFAULT_API_URL))
                .healthPath(getString(source, "CAD_HEALTH_PATH", DEFAULT_HEALTH_PATH))
                .channelUnit(getString(source, "CAD_CHANNEL_UNIT", null))
                .refreshIntervalSeconds(getInt(source, "CAD_REFRESH_INTERVAL_SECONDS", DEFAULT_REFRESH_INTERVAL))
                .pollingEnabled(getBoolean(source, "CAD_POLLING_ENABLED", true))
                .reconnectDelayMillis(getLong(source, "CAD_RECONNECT_DELAY_MS", DEFAULT_RECONNECT_DELAY_MS))
                .maxReconnectDelayMillis(getLong(source, "CAD_MAX_RECONNECT_DELAY_MS", DEFAULT_MAX_RECONNECT_DELAY_MS))
                .probeIntervalSeconds(getInt(source, "CAD_PROBE_INTERVAL_SECONDS", DEFAULT_PROBE_INTERVAL))
                .connectTimeoutSeconds(getInt(source, "CAD_CONNECT_TIMEOUT_SECONDS", DEFAULT_CONNECT_TIMEOUT))
                .readTimeoutSeconds(getInt(source, "CAD_READ_TIMEOUT_SECONDS", DEFAULT_READ_TIMEOUT))
                .logFilePath(getString(source, "CAD_LOG_FILE", DEFAULT_LOG_FILE))
                .fileLoggingEnabled(getBoolean(source, "CAD_FILE_LOGGING_ENABLED", false));

        String realtime = getString(source, "CAD_REALTIME_URL", null);
        if (realtime != null) {
            builder.realtimeUrl(realtime);
        }
        String queueFile = getString(source, "CAD_QUEUE_FILE", null);
        if (queueFile != null) {
            builder.queueFile(Paths.get(queueFile));
        }
        return builder.build();
    }

    public String getApiBaseUrl() {
        return apiBaseUrl;
    }

    public String getRealtimeUrl() {
        return realtimeUrl;
    }

    public String getHealthPath() {
        return healthPath;
    }

    /**
     * Unit the realtime channel subscribes to, or null for an unscoped channel.
     */
    public String getChannelUnit() {
        return channelUnit;
    }

    public int getConnectTimeoutSeconds() {
        return connectTimeoutSeconds;
    }

    public int getReadTimeoutSeconds() {
        return readTimeoutSeconds;
    }

    public int getRefreshIntervalSeconds() {
        return refreshIntervalSeconds;
    }

    public boolean isPollingEnabled() {
        return pollingEnabled;
    }

    public long getReconnectDelayMillis() {
        return reconnectDelayMillis;
    }

    public long getMaxReconnectDelayMillis() {
        return maxReconnectDelayMillis;
    }

    public int getProbeIntervalSeconds() {
        return probeIntervalSeconds;
    }

    public Path getQueueFile() {
        return queueFile;
    }

    public String getLogFilePath() {
        return logFilePath;
    }

    public boolean isFileLoggingEnabled() {
        return fileLoggingEnabled;
    }

    static String deriveRealtimeUrl(String apiBaseUrl) {
        String base = apiBaseUrl.endsWith("/") ? apiBaseUrl : apiBaseUrl + "/";
        if (base.startsWith("https://")) {
            base = "wss://" + base.substring("https://".length());
        } else if (base.startsWith("http://")) {
            base = "ws://" + base.substring("http://".length());
        }
        return base + DEFAULT_REALTIME_PATH;
    }

    // Lookup helpers
    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.trim().isEmpty()) {
                return value;
            }
        }
        return null;
    }

    private static String getString(UnaryOperator<String> source, String key, String defaultValue) {
        String value = source.apply(key);
        if (value == null || value.trim().isEmpty()) {
            LOG.fine(() -> String.format("Using default for %s: %s", key, defaultValue));
            return defaultValue;
        }
        return value.trim();
    }

    private static int getInt(UnaryOperator<String> source, String key, int defaultValue) {
        String value = source.apply(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            LOG.warning(() -> String.format("Invalid integer for %s: %s, using default: %d", key, value, defaultValue));
            return defaultValue;
        }
    }

    private static long getLong(UnaryOperator<String> source, String key, long defaultValue) {
        String value = source.apply(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            LOG.warning(() -> String.format("Invalid number for %s: %s, using default: %d", key, value, defaultValue));
            return defaultValue;
        }
    }

    private static boolean getBoolean(UnaryOperator<String> source, String key, boolean defaultValue) {
        String value = source.apply(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    @Override
    public String toString() {
        return "ConsoleConfig{" +
                "apiBaseUrl='" + apiBaseUrl + '\'' +
                ", realtimeUrl='" + realtimeUrl + '\'' +
                ", channelUnit='" + channelUnit + '\'' +
                ", refreshIntervalSeconds=" + refreshIntervalSeconds +
                ", pollingEnabled=" + pollingEnabled +
                ", queueFile=" + queueFile +
                ", fileLoggingEnabled=" + fileLoggingEnabled +
                '}';
    }

    /**
     * Builder for ConsoleConfig.
     */
    public static final class Builder {
        private String apiBaseUrl = DEFAULT_API_URL;
        private String realtimeUrl;
        private String healthPath = DEFAULT_HEALTH_PATH;
        private String channelUnit;
        private int connectTimeoutSeconds = DEFAULT_CONNECT_TIMEOUT;
        private int readTimeoutSeconds = DEFAULT_READ_TIMEOUT;
        private int refreshIntervalSeconds = DEFAULT_REFRESH_INTERVAL;
        private boolean pollingEnabled = true;
        private long reconnectDelayMillis = DEFAULT_RECONNECT_DELAY_MS;
        private long maxReconnectDelayMillis = DEFAULT_MAX_RECONNECT_DELAY_MS;
        private int probeIntervalSeconds = DEFAULT_PROBE_INTERVAL;
        private Path queueFile = Paths.get(System.getProperty("user.home"), ".cadsync", "mutation-queue.json");
        private String logFilePath = DEFAULT_LOG_FILE;
        private boolean fileLoggingEnabled = false;

        private Builder() {
        }

        public Builder apiBaseUrl(String apiBaseUrl) {
            Objects.requireNonNull(apiBaseUrl, "apiBaseUrl must not be null");
            this.apiBaseUrl = apiBaseUrl.endsWith("/") ? apiBaseUrl : apiBaseUrl + "/";
            return this;
        }

        public Builder realtimeUrl(String realtimeUrl) {
            this.realtimeUrl = Objects.requireNonNull(realtimeUrl, "realtimeUrl must not be null");
            return this;
        }

        public Builder healthPath(String healthPath) {
            Objects.requireNonNull(healthPath, "healthPath must not be null");
            this.healthPath = healthPath.startsWith("/") ? healthPath.substring(1) : healthPath;
            return this;
        }

        public Builder channelUnit(String channelUnit) {
            this.channelUnit = channelUnit == null || channelUnit.trim().isEmpty() ? null : channelUnit.trim();
            return this;
        }

        public Builder connectTimeoutSeconds(int connectTimeoutSeconds) {
            if (connectTimeoutSeconds < 1) {
                throw new IllegalArgumentException("connectTimeoutSeconds must be at least 1");
            }
            this.connectTimeoutSeconds = connectTimeoutSeconds;
            return this;
        }

        public Builder readTimeoutSeconds(int readTimeoutSeconds) {
            if (readTimeoutSeconds < 1) {
                throw new IllegalArgumentException("readTimeoutSeconds must be at least 1");
            }
            this.readTimeoutSeconds = readTimeoutSeconds;
            return this;
        }

        public Builder refreshIntervalSeconds(int refreshIntervalSeconds) {
            if (refreshIntervalSeconds < 1) {
                throw new IllegalArgumentException("refreshIntervalSeconds must be at least 1");
            }
            this.refreshIntervalSeconds = refreshIntervalSeconds;
            return this;
        }

        public Builder pollingEnabled(boolean pollingEnabled) {
            this.pollingEnabled = pollingEnabled;
            return this;
        }

        public Builder reconnectDelayMillis(long reconnectDelayMillis) {
            if (reconnectDelayMillis < 1) {
                throw new IllegalArgumentException("reconnectDelayMillis must be positive");
            }
            this.reconnectDelayMillis = reconnectDelayMillis;
            return this;
        }

        public Builder maxReconnectDelayMillis(long maxReconnectDelayMillis) {
            if (maxReconnectDelayMillis < 1) {
                throw new IllegalArgumentException("maxReconnectDelayMillis must be positive");
            }
            this.maxReconnectDelayMillis = maxReconnectDelayMillis;
            return this;
        }

        public Builder probeIntervalSeconds(int probeIntervalSeconds) {
            if (probeIntervalSeconds < 1) {
                throw new IllegalArgumentException("probeIntervalSeconds must be at least 1");
            }
            this.probeIntervalSeconds = probeIntervalSeconds;
            return this;
        }

        public Builder queueFile(Path queueFile) {
            this.queueFile = Objects.requireNonNull(queueFile, "queueFile must not be null");
            return this;
        }

        public Builder logFilePath(String logFilePath) {
            this.logFilePath = Objects.requireNonNull(logFilePath, "logFilePath must not be null");
            return this;
        }

        public Builder fileLoggingEnabled(boolean fileLoggingEnabled) {
            this.fileLoggingEnabled = fileLoggingEnabled;
            return this;
        }

        public ConsoleConfig build() {
            if (maxReconnectDelayMillis < reconnectDelayMillis) {
                throw new IllegalArgumentException("maxReconnectDelayMillis must not be below reconnectDelayMillis");
            }
            return new ConsoleConfig(this);
        }
    }
}
