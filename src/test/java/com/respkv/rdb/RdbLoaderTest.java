package com.respkv.rdb;

import com.respkv.core.InMemoryStore;
import com.respkv.core.KeyValuePair;
import com.respkv.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class RdbLoaderTest {

    private static final long NOW = 1_700_000_000_000L;

    private MutableClock clock;
    private InMemoryStore store;
    private RdbLoader loader;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        store = new InMemoryStore(clock);
        loader = new RdbLoader(store, clock);
    }

    /**
     * Minimal RDB writer for building fixtures.
     */
    private static final class RdbBuilder {
        private final ByteArrayOutputStream out = new ByteArrayOutputStream();

        RdbBuilder() {
            raw("REDIS0011".getBytes(StandardCharsets.US_ASCII));
        }

        RdbBuilder raw(byte[] bytes) {
            out.write(bytes, 0, bytes.length);
            return this;
        }

        RdbBuilder op(int opcode) {
            out.write(opcode);
            return this;
        }

        RdbBuilder string(String text) {
            byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
            if (bytes.length < 64) {
                out.write(bytes.length);
            } else {
                out.write(0x40 | (bytes.length >> 8));
                out.write(bytes.length & 0xFF);
            }
            return raw(bytes);
        }

        RdbBuilder aux(String key, String value) {
            return op(RdbConstants.OP_AUX).string(key).string(value);
        }

        RdbBuilder selectDb(int db) {
            return op(RdbConstants.OP_SELECTDB).op(db);
        }

        RdbBuilder resizeDb(int size, int expires) {
            return op(RdbConstants.OP_RESIZEDB).op(size).op(expires);
        }

        RdbBuilder entry(String key, String value) {
            return op(RdbConstants.TYPE_STRING).string(key).string(value);
        }

        RdbBuilder expireMillis(long millis) {
            op(RdbConstants.OP_EXPIRETIME_MS);
            for (int i = 0; i < 8; i++) {
                out.write((int) (millis >>> (8 * i)) & 0xFF);
            }
            return this;
        }

        RdbBuilder expireSeconds(long seconds) {
            op(RdbConstants.OP_EXPIRETIME);
            for (int i = 0; i < 4; i++) {
                out.write((int) (seconds >>> (8 * i)) & 0xFF);
            }
            return this;
        }

        RdbBuilder eof() {
            op(RdbConstants.OP_EOF);
            // Checksum, ignored by the loader
            return raw(new byte[8]);
        }

        byte[] build() {
            return out.toByteArray();
        }
    }

    private int load(byte[] bytes) throws IOException {
        return loader.load(new ByteArrayInputStream(bytes));
    }

    private String value(String key) {
        return store.get(key.getBytes(StandardCharsets.UTF_8))
                .map(entry -> new String(entry.getValueUnsafe(), StandardCharsets.UTF_8))
                .orElse(null);
    }

    private long expiresAt(String key) {
        return store.get(key.getBytes(StandardCharsets.UTF_8)).orElseThrow().getExpiresAt();
    }

    @Test
    void load_plainStringKeys() throws IOException {
        byte[] rdb = new RdbBuilder()
                .aux("redis-ver", "7.2.0")
                .aux("redis-bits", "64")
                .selectDb(0)
                .resizeDb(2, 0)
                .entry("foo", "bar")
                .entry("baz", "qux")
                .eof()
                .build();

        assertThat(load(rdb)).isEqualTo(2);
        assertThat(value("foo")).isEqualTo("bar");
        assertThat(value("baz")).isEqualTo("qux");
        assertThat(store.get("foo".getBytes(StandardCharsets.UTF_8)).orElseThrow().getExpiresAt())
                .isEqualTo(KeyValuePair.NO_EXPIRY);
    }

    @Test
    void load_millisecondAndSecondExpirations() throws IOException {
        long futureMillis = NOW + 60_000;
        long futureSeconds = NOW / 1000 + 3600;
        byte[] rdb = new RdbBuilder()
                .selectDb(0)
                .expireMillis(futureMillis).entry("ms", "1")
                .expireSeconds(futureSeconds).entry("sec", "2")
                .entry("none", "3")
                .eof()
                .build();

        assertThat(load(rdb)).isEqualTo(3);
        assertThat(expiresAt("ms")).isEqualTo(futureMillis);
        assertThat(expiresAt("sec")).isEqualTo(futureSeconds * 1000);
        assertThat(expiresAt("none")).isEqualTo(KeyValuePair.NO_EXPIRY);
    }

    @Test
    void load_skipsExpiredKeys() throws IOException {
        byte[] rdb = new RdbBuilder()
                .selectDb(0)
                .expireMillis(NOW - 1).entry("old", "x")
                .expireMillis(NOW).entry("boundary", "x")
                .entry("fresh", "y")
                .eof()
                .build();

        assertThat(load(rdb)).isEqualTo(1);
        assertThat(value("old")).isNull();
        assertThat(value("boundary")).isNull();
        assertThat(value("fresh")).isEqualTo("y");
    }

    @Test
    void load_expiryAppliesOnlyToNextKey() throws IOException {
        byte[] rdb = new RdbBuilder()
                .selectDb(0)
                .expireMillis(NOW + 10).entry("a", "1")
                .entry("b", "2")
                .eof()
                .build();

        load(rdb);

        assertThat(expiresAt("a")).isEqualTo(NOW + 10);
        assertThat(expiresAt("b")).isEqualTo(KeyValuePair.NO_EXPIRY);
    }

    @Test
    void load_onlyDatabaseZero() throws IOException {
        byte[] rdb = new RdbBuilder()
                .selectDb(0).entry("zero", "0")
                .selectDb(1).entry("one", "1")
                .eof()
                .build();

        assertThat(load(rdb)).isEqualTo(1);
        assertThat(value("zero")).isEqualTo("0");
        assertThat(value("one")).isNull();
    }

    @Test
    void load_integerEncodedStrings() throws IOException {
        byte[] rdb = new RdbBuilder()
                .selectDb(0)
                .op(RdbConstants.TYPE_STRING).string("i8").raw(new byte[]{(byte) 0xC0, (byte) 0xFB})
                .op(RdbConstants.TYPE_STRING).string("i16").raw(new byte[]{(byte) 0xC1, 0x39, 0x30})
                .op(RdbConstants.TYPE_STRING).string("i32").raw(new byte[]{(byte) 0xC2, 0x15, (byte) 0xCD, 0x5B, 0x07})
                .eof()
                .build();

        load(rdb);

        assertThat(value("i8")).isEqualTo("-5");
        assertThat(value("i16")).isEqualTo("12345");
        assertThat(value("i32")).isEqualTo("123456789");
    }

    @Test
    void load_fourteenBitLengths() throws IOException {
        String longValue = "v".repeat(300);
        byte[] rdb = new RdbBuilder().selectDb(0).entry("long", longValue).eof().build();

        load(rdb);

        assertThat(value("long")).isEqualTo(longValue);
    }

    @Test
    void load_missingFile_returnsZero(@TempDir Path dir) throws IOException {
        assertThat(loader.load(dir.resolve("absent.rdb"))).isZero();
        assertThat(store.size()).isZero();
    }

    @Test
    void load_fromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("dump.rdb");
        Files.write(file, new RdbBuilder().selectDb(0).entry("k", "v").eof().build());

        assertThat(loader.load(file)).isEqualTo(1);
        assertThat(value("k")).isEqualTo("v");
    }

    @Test
    void load_badMagic_throws() {
        assertThatThrownBy(() -> load("RUBBISH0011".getBytes(StandardCharsets.US_ASCII)))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("bad magic");
    }

    @Test
    void load_badVersion_throws() {
        assertThatThrownBy(() -> load("REDISab12".getBytes(StandardCharsets.US_ASCII)))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("version");
    }

    @Test
    void load_truncated_throwsAndKeepsLoadedKeys() {
        byte[] full = new RdbBuilder().selectDb(0).entry("first", "1").entry("second", "2").build();
        byte[] truncated = java.util.Arrays.copyOf(full, full.length - 1);

        assertThatThrownBy(() -> load(truncated))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Truncated");
        assertThat(value("first")).isEqualTo("1");
    }

    @Test
    void load_compressedString_throws() {
        byte[] rdb = new RdbBuilder()
                .selectDb(0)
                .op(RdbConstants.TYPE_STRING).string("k").raw(new byte[]{(byte) 0xC3, 0x01, 0x01, 0x00})
                .eof()
                .build();

        assertThatThrownBy(() -> load(rdb))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("LZF");
    }

    @Test
    void load_nonStringType_throws() {
        byte[] rdb = new RdbBuilder().selectDb(0).op(0x01).string("list").eof().build();

        assertThatThrownBy(() -> load(rdb))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Unsupported value type");
    }
}
