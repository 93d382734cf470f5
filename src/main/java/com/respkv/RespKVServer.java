package com.respkv;

import com.respkv.config.ServerConfig;
import com.respkv.core.InMemoryStore;
import com.respkv.core.KVStore;
import com.respkv.network.TcpServer;
import com.respkv.rdb.RdbLoader;
import com.respkv.util.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.time.Clock;

/**
 * RespKV Server entry point.
 * Loads the snapshot, then serves RESP clients until the JVM shuts down.
 */
public class RespKVServer {

    private static final Logger logger = LoggerFactory.getLogger(RespKVServer.class);

    static final String VERSION = "1.0.0";

    private final ServerConfig config;
    private final Clock clock;
    private final KVStore store;
    private final MetricsCollector metrics;
    private final TcpServer tcpServer;
    private Thread shutdownHook;

    /**
     * Create a server with a fresh store and metrics.
     *
     * @param config startup configuration
     */
    public RespKVServer(ServerConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * Create a server with an explicit time source.
     *
     * @param config startup configuration
     * @param clock  time source for expiry
     */
    public RespKVServer(ServerConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.store = new InMemoryStore(clock);
        this.metrics = new MetricsCollector();
        this.metrics.bindStore(store);
        this.tcpServer = new TcpServer(config, store, metrics, clock);
    }

    /**
     * Load the snapshot and start serving on a background thread.
     *
     * @throws IOException if the listen socket cannot be bound
     */
    public void start() throws IOException {
        logger.info("Starting RespKV Server v{}", VERSION);
        logger.info("Config: {}", config);

        loadSnapshot();

        shutdownHook = new Thread(() -> {
            logger.info("Shutdown signal received");
            stop();
        }, "respkv-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        tcpServer.start();
        logger.info("RespKV Server started successfully");
    }

    /**
     * Load the snapshot and run the event loop on the calling thread.
     *
     * @throws IOException if the listen socket cannot be bound
     */
    public void startAndBlock() throws IOException {
        logger.info("Starting RespKV Server v{}", VERSION);
        loadSnapshot();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received");
            tcpServer.stop();
        }, "respkv-shutdown"));

        tcpServer.startAndBlock();
    }

    /**
     * Fill the store from {@code <dir>/<dbfilename>}. A malformed file is
     * logged and the server starts with whatever was loaded before the error.
     */
    int loadSnapshot() {
        RdbLoader loader = new RdbLoader(store, clock);
        try {
            return loader.load(config.getSnapshotPath());
        } catch (IOException e) {
            logger.error("Failed to load snapshot {}: {}", config.getSnapshotPath(), e.getMessage());
            return 0;
        }
    }

    /**
     * Stop the server.
     */
    public void stop() {
        logger.info("Stopping RespKV Server");
        tcpServer.stop();
        if (shutdownHook != null && Thread.currentThread() != shutdownHook) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException e) {
                logger.debug("JVM already shutting down");
            }
            shutdownHook = null;
        }
        logger.info("RespKV Server stopped. {}", metrics.summary().replace(System.lineSeparator(), " | "));
    }

    public boolean isRunning() {
        return tcpServer.isRunning();
    }

    /**
     * Get the bound port; differs from the configured one when it was 0.
     */
    public int getPort() {
        return tcpServer.getPort();
    }

    public ServerConfig getConfig() {
        return config;
    }

    public KVStore getStore() {
        return store;
    }

    public MetricsCollector getMetrics() {
        return metrics;
    }

    public int getConnectionCount() {
        return tcpServer.getConnectionCount();
    }

    // ==================== Command line ====================

    /**
     * Main entry point.
     */
    public static void main(String[] args) {
        for (String arg : args) {
            if ("--help".equals(arg) || "-h".equals(arg)) {
                printHelp();
                return;
            }
            if ("--version".equals(arg) || "-v".equals(arg)) {
                System.out.println("RespKV Server v" + VERSION);
                return;
            }
        }

        ServerConfig config;
        try {
            config = parseArguments(args);
        } catch (IllegalArgumentException e) {
            exitWithError(e.getMessage());
            return;
        }

        ensureLogsDirectory();

        RespKVServer server = new RespKVServer(config);
        try {
            server.startAndBlock();
        } catch (IOException e) {
            logger.error("Failed to start server: {}", e.getMessage());
            System.exit(1);
        }
    }

    /**
     * Parse command line options into a config. Long options accept both
     * {@code --name value} and {@code --name=value}.
     *
     * @param args command line arguments
     * @return the config, with defaults for omitted options
     * @throws IllegalArgumentException on unknown options, missing values, or bad values
     */
    static ServerConfig parseArguments(String[] args) {
        ServerConfig.Builder builder = ServerConfig.builder();
        for (int i = 0; i < args.length; i++) {
            String option = args[i];
            String value = null;
            int eq = option.indexOf('=');
            if (option.startsWith("--") && eq > 0) {
                value = option.substring(eq + 1);
                option = option.substring(0, eq);
            }

            switch (option) {
                case "--dir":
                case "-d":
                    builder.dir(value != null ? value : requireValue(args, ++i, option));
                    break;
                case "--dbfilename":
                    builder.dbfilename(value != null ? value : requireValue(args, ++i, option));
                    break;
                case "--host":
                case "-H":
                    builder.host(value != null ? value : requireValue(args, ++i, option));
                    break;
                case "--port":
                case "-p":
                    builder.port(parsePort(value != null ? value : requireValue(args, ++i, option)));
                    break;
                default:
                    throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }
        return builder.build();
    }

    private static String requireValue(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException(option + " requires a value");
        }
        return args[index];
    }

    private static int parsePort(String value) {
        int port;
        try {
            port = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port number: " + value);
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("Port must be between 1 and 65535");
        }
        return port;
    }

    private static void ensureLogsDirectory() {
        File logsDir = new File("logs");
        if (!logsDir.exists() && !logsDir.mkdir()) {
            logger.warn("Failed to create logs directory, file logging may not work");
        }
    }

    private static void exitWithError(String message) {
        System.err.println("Error: " + message);
        System.err.println("Use --help for usage information");
        System.exit(1);
    }

    private static void printHelp() {
        System.out.println("RespKV Server - Redis-compatible in-memory key-value store");
        System.out.println();
        System.out.println("Usage: respkv [options]");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  -d, --dir <path>          Directory holding the snapshot (default: " + ServerConfig.DEFAULT_DIR + ")");
        System.out.println("      --dbfilename <name>   Snapshot file name (default: " + ServerConfig.DEFAULT_DBFILENAME + ")");
        System.out.println("  -H, --host <host>         Address to listen on (default: " + ServerConfig.DEFAULT_HOST + ")");
        System.out.println("  -p, --port <port>         Port to listen on (default: " + ServerConfig.DEFAULT_PORT + ")");
        System.out.println("  -h, --help                Show this help message");
        System.out.println("  -v, --version             Show version");
        System.out.println();
        System.out.println("Environment:");
        System.out.println("  RESPKV_EXPIRE_SWEEP_MS     Active expiry interval in ms, 0 disables (default: "
                + ServerConfig.DEFAULT_EXPIRE_SWEEP_MS + ")");
        System.out.println("  RESPKV_MAX_INBOUND_BYTES   Per-connection request buffer limit");
        System.out.println();
    }
}
