package com.respkv.rdb;

import com.respkv.core.KVStore;
import com.respkv.core.KeyValuePair;
import com.respkv.core.SetCondition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Arrays;
import java.util.Objects;

/**
 * Loads string keys from an RDB snapshot into a store.
 * Only database 0 is loaded; keys already expired at load time are skipped.
 */
public class RdbLoader {

    private static final Logger logger = LoggerFactory.getLogger(RdbLoader.class);

    // An expiry opcode applies only to the key that follows it
    private static final long NO_PENDING_EXPIRY = -1;

    private final KVStore store;
    private final Clock clock;

    public RdbLoader(KVStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    /**
     * Load a snapshot file.
     *
     * @param file the snapshot path
     * @return number of keys loaded; 0 if the file does not exist
     * @throws IOException if the file cannot be read or is malformed
     */
    public int load(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            logger.info("No snapshot at {}, starting empty", file.toAbsolutePath());
            return 0;
        }

        logger.info("Loading snapshot {}", file.toAbsolutePath());
        long start = System.nanoTime();
        int loaded;
        try (InputStream in = new BufferedInputStream(Files.newInputStream(file))) {
            loaded = load(in);
        }
        logger.info("Snapshot loaded: {} keys in {} ms", loaded, (System.nanoTime() - start) / 1_000_000);
        return loaded;
    }

    /**
     * Load a snapshot from a stream. The stream is not closed.
     *
     * @param in the snapshot bytes
     * @return number of keys loaded
     * @throws IOException if the stream is malformed or truncated
     */
    public int load(InputStream in) throws IOException {
        RdbDecoder decoder = new RdbDecoder(in);
        try {
            readHeader(decoder);
            return readBody(decoder);
        } catch (EOFException e) {
            throw new IOException("Truncated snapshot", e);
        }
    }

    private void readHeader(RdbDecoder decoder) throws IOException {
        byte[] magic = decoder.readBytes(RdbConstants.MAGIC.length);
        if (!Arrays.equals(magic, RdbConstants.MAGIC)) {
            throw new IOException("Invalid snapshot: bad magic");
        }
        String version = new String(decoder.readBytes(RdbConstants.VERSION_LENGTH), StandardCharsets.US_ASCII);
        for (int i = 0; i < version.length(); i++) {
            if (!Character.isDigit(version.charAt(i))) {
                throw new IOException("Invalid snapshot version: " + version);
            }
        }
        logger.debug("Snapshot format version {}", Integer.parseInt(version));
    }

    private int readBody(RdbDecoder decoder) throws IOException {
        long now = clock.millis();
        long database = 0;
        long expiresAt = NO_PENDING_EXPIRY;
        int loaded = 0;
        int skipped = 0;

        while (true) {
            int opcode = decoder.readByte();
            switch (opcode) {
                case RdbConstants.OP_EOF:
                    // Trailing checksum, if present, is not verified
                    if (skipped > 0) {
                        logger.info("Skipped {} expired or non-default-database keys", skipped);
                    }
                    return loaded;
                case RdbConstants.OP_SELECTDB:
                    database = decoder.readLength();
                    continue;
                case RdbConstants.OP_RESIZEDB:
                    decoder.readLength();
                    decoder.readLength();
                    continue;
                case RdbConstants.OP_AUX: {
                    String key = new String(decoder.readString(), StandardCharsets.UTF_8);
                    String value = new String(decoder.readString(), StandardCharsets.UTF_8);
                    logger.debug("Snapshot aux {}={}", key, value);
                    continue;
                }
                case RdbConstants.OP_EXPIRETIME_MS:
                    expiresAt = decoder.readInt64LE();
                    if (expiresAt < 0) {
                        // Unsigned overflow, effectively never
                        expiresAt = Long.MAX_VALUE;
                    }
                    continue;
                case RdbConstants.OP_EXPIRETIME:
                    expiresAt = decoder.readUInt32LE() * 1000;
                    continue;
                case RdbConstants.OP_IDLE:
                    decoder.readLength();
                    continue;
                case RdbConstants.OP_FREQ:
                    decoder.readByte();
                    continue;
                case RdbConstants.OP_MODULE_AUX:
                    throw new IOException("Module data is not supported");
                case RdbConstants.TYPE_STRING:
                    break;
                default:
                    throw new IOException("Unsupported value type 0x" + Integer.toHexString(opcode));
            }

            byte[] key = decoder.readString();
            byte[] value = decoder.readString();
            long entryExpiry = expiresAt;
            expiresAt = NO_PENDING_EXPIRY;

            boolean expired = entryExpiry != NO_PENDING_EXPIRY && entryExpiry <= now;
            if (database != 0 || expired) {
                skipped++;
                continue;
            }
            store.set(key, value, entryExpiry == NO_PENDING_EXPIRY ? KeyValuePair.NO_EXPIRY : entryExpiry,
                    SetCondition.ALWAYS, false);
            loaded++;
        }
    }
}
