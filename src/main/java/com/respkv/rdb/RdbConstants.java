package com.respkv.rdb;

import java.nio.charset.StandardCharsets;

/**
 * Markers and opcodes of the RDB snapshot format.
 */
public final class RdbConstants {

    // Header: REDIS followed by a 4 digit version
    public static final byte[] MAGIC = "REDIS".getBytes(StandardCharsets.US_ASCII);
    public static final int VERSION_LENGTH = 4;

    // ==================== Opcodes ====================

    /** Module auxiliary data (not supported). */
    public static final int OP_MODULE_AUX = 0xF7;
    /** LRU idle time of the next key, a length. */
    public static final int OP_IDLE = 0xF8;
    /** LFU frequency of the next key, one byte. */
    public static final int OP_FREQ = 0xF9;
    /** Auxiliary field: two strings. */
    public static final int OP_AUX = 0xFA;
    /** Hash table size hints: two lengths. */
    public static final int OP_RESIZEDB = 0xFB;
    /** Expiry of the next key in millis, 8 bytes little-endian. */
    public static final int OP_EXPIRETIME_MS = 0xFC;
    /** Expiry of the next key in seconds, 4 bytes little-endian. */
    public static final int OP_EXPIRETIME = 0xFD;
    /** Database selector: a length. */
    public static final int OP_SELECTDB = 0xFE;
    public static final int OP_EOF = 0xFF;

    // ==================== Value types ====================

    public static final int TYPE_STRING = 0;

    // ==================== Length encoding ====================

    static final int LEN_6BIT = 0;
    static final int LEN_14BIT = 1;
    static final int LEN_32BIT = 2;
    static final int LEN_ENCVAL = 3;

    // Second byte 0x80/0x81 of the 10 prefix
    static final int LEN_32BIT_MARKER = 0x80;
    static final int LEN_64BIT_MARKER = 0x81;

    static final int ENC_INT8 = 0;
    static final int ENC_INT16 = 1;
    static final int ENC_INT32 = 2;
    static final int ENC_LZF = 3;

    private RdbConstants() {
        // Utility class
    }
}
