package com.respkv.util;

import com.respkv.core.InMemoryStore;
import com.respkv.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class MetricsCollectorTest {

    private SimpleMeterRegistry registry;
    private MetricsCollector metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new MetricsCollector(registry);
    }

    @Test
    void recordCommand_countsPerCommandCaseInsensitively() {
        metrics.recordCommand("GET", 1_000, false);
        metrics.recordCommand("get", 1_000, false);
        metrics.recordCommand("Set", 1_000, false);

        assertThat(metrics.getCommandCount("get")).isEqualTo(2);
        assertThat(metrics.getCommandCount("SET")).isEqualTo(1);
        assertThat(metrics.getCommandCount("del")).isZero();
        assertThat(metrics.getTotalCommands()).isEqualTo(3);
        assertThat(registry.get(MetricsCollector.COMMANDS).tag("command", "get").counter().count())
            .isEqualTo(2.0);
    }

    @Test
    void recordCommand_errorsAndLatency() {
        metrics.recordCommand("echo", 2_000_000, true);
        metrics.recordCommand("ping", 4_000_000, false);

        assertThat(metrics.getCommandErrors()).isEqualTo(1);
        assertThat(metrics.getMeanLatencyMs()).isCloseTo(3.0, within(0.001));
        assertThat(registry.get("respkv.command.latency").timer().count()).isEqualTo(2);
    }

    @Test
    void protocolErrors_taggedSeparately() {
        metrics.recordProtocolError();
        metrics.recordProtocolError();

        assertThat(metrics.getProtocolErrors()).isEqualTo(2);
        assertThat(metrics.getCommandErrors()).isZero();
        assertThat(registry.get(MetricsCollector.ERRORS).tag("type", "protocol").counter().count())
            .isEqualTo(2.0);
    }

    @Test
    void connections_trackActiveAndAccepted() {
        metrics.connectionOpened();
        metrics.connectionOpened();
        metrics.connectionClosed();

        assertThat(metrics.getActiveConnections()).isEqualTo(1);
        assertThat(metrics.getAcceptedConnections()).isEqualTo(2);
        assertThat(registry.get("respkv.connections").gauge().value()).isEqualTo(1.0);
    }

    @Test
    void bindStore_publishesKeyspaceMeters() {
        MutableClock clock = new MutableClock(1_000);
        InMemoryStore store = new InMemoryStore(clock);
        metrics.bindStore(store);

        store.set(bytes("a"), bytes("1"));
        store.set(bytes("b"), bytes("2"), 1_500, com.respkv.core.SetCondition.ALWAYS, false);
        assertThat(registry.get("respkv.store.size").gauge().value()).isEqualTo(2.0);

        clock.advance(Duration.ofSeconds(1));
        assertThat(store.get(bytes("b"))).isEmpty();

        assertThat(registry.get("respkv.store.size").gauge().value()).isEqualTo(1.0);
        assertThat(registry.get("respkv.keys.expired").functionCounter().count()).isEqualTo(1.0);
    }

    @Test
    void summary_includesCounts() {
        metrics.recordCommand("ping", 1_000, false);
        metrics.connectionOpened();

        String summary = metrics.summary();

        assertThat(summary)
            .contains("RespKV Metrics Summary")
            .contains("Commands: 1 (errors=0)")
            .contains("Connections: 1 active, 1 accepted");
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
