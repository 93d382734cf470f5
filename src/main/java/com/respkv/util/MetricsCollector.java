package com.respkv.util;

import com.respkv.core.KVStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.search.Search;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;

/**
 * Metrics collector for RespKV.
 * Tracks command throughput, errors, connections and keyspace statistics.
 */
public class MetricsCollector {

    static final String COMMANDS = "respkv.commands";
    static final String ERRORS = "respkv.errors";

    private final MeterRegistry registry;

    // Counters
    private final Map<String, Counter> commandCounters = new ConcurrentHashMap<>();
    private final Counter commandErrors;
    private final Counter protocolErrors;
    private final Counter connectionsAccepted;

    // Timers
    private final Timer commandLatency;

    // Gauges
    private final LongAdder activeConnections;

    /**
     * Create a metrics collector with a simple registry.
     */
    public MetricsCollector() {
        this(new SimpleMeterRegistry());
    }

    /**
     * Create a metrics collector with a custom registry.
     *
     * @param registry the Micrometer registry to use
     */
    public MetricsCollector(MeterRegistry registry) {
        this.registry = registry;

        this.commandErrors = Counter.builder(ERRORS)
            .tag("type", "command")
            .description("Commands answered with an error reply")
            .register(registry);

        this.protocolErrors = Counter.builder(ERRORS)
            .tag("type", "protocol")
            .description("Connections closed for malformed frames")
            .register(registry);

        this.connectionsAccepted = Counter.builder("respkv.connections.accepted")
            .description("Total accepted connections")
            .register(registry);

        this.commandLatency = Timer.builder("respkv.command.latency")
            .description("Command execution latency")
            .register(registry);

        this.activeConnections = new LongAdder();
        Gauge.builder("respkv.connections", activeConnections, LongAdder::sum)
            .description("Active connections")
            .register(registry);
    }

    /**
     * Publish keyspace gauges backed by the given store.
     *
     * @param store the store to observe
     */
    public void bindStore(KVStore store) {
        Gauge.builder("respkv.store.size", store, KVStore::size)
            .description("Number of entries in store")
            .register(registry);
        FunctionCounter.builder("respkv.keys.expired", store, KVStore::expiredCount)
            .description("Entries removed because they expired")
            .register(registry);
    }

    // Command recording

    /**
     * Record one executed command.
     *
     * @param name          command name as sent by the client
     * @param durationNanos execution time
     * @param error         whether the reply was an error
     */
    public void recordCommand(String name, long durationNanos, boolean error) {
        String tag = name.toLowerCase(Locale.ROOT);
        commandCounters.computeIfAbsent(tag, n -> Counter.builder(COMMANDS)
            .tag("command", n)
            .description("Executed commands")
            .register(registry)).increment();
        commandLatency.record(durationNanos, TimeUnit.NANOSECONDS);
        if (error) {
            commandErrors.increment();
        }
    }

    public void recordProtocolError() {
        protocolErrors.increment();
    }

    // Connection tracking

    public void connectionOpened() {
        connectionsAccepted.increment();
        activeConnections.increment();
    }

    public void connectionClosed() {
        activeConnections.decrement();
    }

    // Getters for metrics values

    public long getCommandCount(String name) {
        Counter counter = commandCounters.get(name.toLowerCase(Locale.ROOT));
        return counter != null ? (long) counter.count() : 0;
    }

    public long getTotalCommands() {
        return (long) Search.in(registry).name(COMMANDS).counters().stream()
            .mapToDouble(Counter::count)
            .sum();
    }

    public long getCommandErrors() {
        return (long) commandErrors.count();
    }

    public long getProtocolErrors() {
        return (long) protocolErrors.count();
    }

    public long getActiveConnections() {
        return activeConnections.sum();
    }

    public long getAcceptedConnections() {
        return (long) connectionsAccepted.count();
    }

    public double getMeanLatencyMs() {
        return commandLatency.mean(TimeUnit.MILLISECONDS);
    }

    /**
     * Get the underlying registry.
     *
     * @return the MeterRegistry
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    /**
     * Print a summary of current metrics.
     *
     * @return formatted metrics string
     */
    public String summary() {
        return String.format(
            "RespKV Metrics Summary%n" +
            "======================%n" +
            "Commands: %d (errors=%d)%n" +
            "Protocol errors: %d%n" +
            "Connections: %d active, %d accepted%n" +
            "Latency (mean): %.3fms",
            getTotalCommands(), getCommandErrors(),
            getProtocolErrors(),
            getActiveConnections(), getAcceptedConnections(),
            getMeanLatencyMs()
        );
    }
}
