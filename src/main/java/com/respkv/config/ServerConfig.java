package com.respkv.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable server configuration.
 * Startup parameters come from the command line; tuning values default from
 * RESPKV_* environment variables or respkv.* system properties.
 */
public final class ServerConfig {

    private static final Logger logger = LoggerFactory.getLogger(ServerConfig.class);

    public static final String DEFAULT_DIR = "/tmp/redis-data";
    public static final String DEFAULT_DBFILENAME = "dump.rdb";
    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 6379;
    public static final long DEFAULT_EXPIRE_SWEEP_MS = 100;
    // Largest bulk string plus room for its header and the rest of a pipeline
    public static final int DEFAULT_MAX_INBOUND_BYTES = 512 * 1024 * 1024 + 64 * 1024;

    private final String dir;
    private final String dbfilename;
    private final String host;
    private final int port;
    private final long expireSweepIntervalMs;
    private final int maxInboundBufferBytes;

    private ServerConfig(Builder builder) {
        this.dir = builder.dir;
        this.dbfilename = builder.dbfilename;
        this.host = builder.host;
        this.port = builder.port;
        this.expireSweepIntervalMs = builder.expireSweepIntervalMs;
        this.maxInboundBufferBytes = builder.maxInboundBufferBytes;
    }

    /**
     * Create a config builder seeded with defaults.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a config with every value at its default
     */
    public static ServerConfig defaults() {
        return builder().build();
    }

    public String getDir() {
        return dir;
    }

    public String getDbfilename() {
        return dbfilename;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public long getExpireSweepIntervalMs() {
        return expireSweepIntervalMs;
    }

    public int getMaxInboundBufferBytes() {
        return maxInboundBufferBytes;
    }

    /**
     * @return path of the snapshot file, {@code <dir>/<dbfilename>}
     */
    public Path getSnapshotPath() {
        return Path.of(dir, dbfilename);
    }

    /**
     * Resolve a parameter by name, as CONFIG GET sees it.
     *
     * @param name parameter name, case-insensitive
     * @return the value, or null if the parameter is unknown
     */
    public String get(String name) {
        if (name == null) {
            return null;
        }
        switch (name.toLowerCase(Locale.ROOT)) {
            case "dir":
                return dir;
            case "dbfilename":
                return dbfilename;
            case "host":
            case "bind":
                return host;
            case "port":
                return Integer.toString(port);
            default:
                return null;
        }
    }

    @Override
    public String toString() {
        return "ServerConfig{" +
               "dir='" + dir + '\'' +
               ", dbfilename='" + dbfilename + '\'' +
               ", host='" + host + '\'' +
               ", port=" + port +
               ", expireSweepIntervalMs=" + expireSweepIntervalMs +
               ", maxInboundBufferBytes=" + maxInboundBufferBytes +
               '}';
    }

    // ==================== Environment defaults ====================

    private static String lookup(String envKey, String propKey) {
        String value = System.getenv(envKey);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(propKey);
        }
        return value == null || value.isEmpty() ? null : value.trim();
    }

    static long getDefaultExpireSweepMs() {
        String value = lookup("RESPKV_EXPIRE_SWEEP_MS", "respkv.expire.sweep.ms");
        if (value != null) {
            try {
                long ms = Long.parseLong(value);
                if (ms >= 0) {
                    return ms;
                }
                logger.warn("Negative expire sweep interval {}, using default", value);
            } catch (NumberFormatException e) {
                logger.warn("Invalid expire sweep interval: {}, using default", value);
            }
        }
        return DEFAULT_EXPIRE_SWEEP_MS;
    }

    static int getDefaultMaxInboundBytes() {
        String value = lookup("RESPKV_MAX_INBOUND_BYTES", "respkv.max.inbound.bytes");
        if (value != null) {
            try {
                int bytes = Integer.parseInt(value);
                if (bytes > 0) {
                    return bytes;
                }
                logger.warn("Non-positive max inbound bytes {}, using default", value);
            } catch (NumberFormatException e) {
                logger.warn("Invalid max inbound bytes: {}, using default", value);
            }
        }
        return DEFAULT_MAX_INBOUND_BYTES;
    }

    /**
     * Builder for ServerConfig.
     */
    public static class Builder {
        private String dir = DEFAULT_DIR;
        private String dbfilename = DEFAULT_DBFILENAME;
        private String host = DEFAULT_HOST;
        private int port = DEFAULT_PORT;
        private long expireSweepIntervalMs = getDefaultExpireSweepMs();
        private int maxInboundBufferBytes = getDefaultMaxInboundBytes();

        public Builder dir(String dir) {
            this.dir = requireNonEmpty(dir, "dir");
            return this;
        }

        public Builder dbfilename(String dbfilename) {
            this.dbfilename = requireNonEmpty(dbfilename, "dbfilename");
            return this;
        }

        public Builder host(String host) {
            this.host = requireNonEmpty(host, "host");
            return this;
        }

        /**
         * @param port listen port; 0 picks an ephemeral port
         */
        public Builder port(int port) {
            if (port < 0 || port > 65535) {
                throw new IllegalArgumentException("port must be between 0 and 65535, got: " + port);
            }
            this.port = port;
            return this;
        }

        /**
         * @param intervalMs active expiry sweep interval; 0 disables the sweep
         */
        public Builder expireSweepIntervalMs(long intervalMs) {
            if (intervalMs < 0) {
                throw new IllegalArgumentException("expireSweepIntervalMs must be non-negative, got: " + intervalMs);
            }
            this.expireSweepIntervalMs = intervalMs;
            return this;
        }

        public Builder maxInboundBufferBytes(int bytes) {
            if (bytes <= 0) {
                throw new IllegalArgumentException("maxInboundBufferBytes must be positive, got: " + bytes);
            }
            this.maxInboundBufferBytes = bytes;
            return this;
        }

        public ServerConfig build() {
            return new ServerConfig(this);
        }

        private static String requireNonEmpty(String value, String name) {
            Objects.requireNonNull(value, name + " cannot be null");
            if (value.isEmpty()) {
                throw new IllegalArgumentException(name + " cannot be empty");
            }
            return value;
        }
    }
}
