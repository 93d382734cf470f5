package com.respkv.rdb;

import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Reads the primitive encodings of an RDB stream: opcodes, length-prefixed
 * sizes, strings and little-endian timestamps.
 */
public class RdbDecoder {

    private final DataInputStream in;

    public RdbDecoder(InputStream in) {
        this.in = new DataInputStream(in);
    }

    /**
     * Read one unsigned byte.
     *
     * @return value in 0..255
     * @throws EOFException if the stream ends
     */
    public int readByte() throws IOException {
        return in.readUnsignedByte();
    }

    public byte[] readBytes(int length) throws IOException {
        byte[] bytes = new byte[length];
        in.readFully(bytes);
        return bytes;
    }

    /**
     * Read a plain length. Special (integer) encodings are rejected here.
     *
     * @return the length
     * @throws IOException if the encoding is special or the stream ends
     */
    public long readLength() throws IOException {
        int first = in.readUnsignedByte();
        int kind = (first & 0xC0) >> 6;
        if (kind == RdbConstants.LEN_ENCVAL) {
            throw new IOException("Expected a length, got special encoding 0x" + Integer.toHexString(first));
        }
        return readLengthBody(first, kind);
    }

    private long readLengthBody(int first, int kind) throws IOException {
        switch (kind) {
            case RdbConstants.LEN_6BIT:
                return first & 0x3F;
            case RdbConstants.LEN_14BIT:
                return ((first & 0x3F) << 8) | in.readUnsignedByte();
            case RdbConstants.LEN_32BIT:
                if (first == RdbConstants.LEN_64BIT_MARKER) {
                    long length = in.readLong();
                    if (length < 0) {
                        throw new IOException("Length out of range: " + Long.toUnsignedString(length));
                    }
                    return length;
                }
                return in.readInt() & 0xFFFFFFFFL;
            default:
                throw new IOException("Unknown length encoding: " + kind);
        }
    }

    /**
     * Read a string object. Integer-encoded strings are returned as their
     * decimal ASCII form.
     *
     * @return the string bytes
     * @throws IOException on LZF compression, oversized strings, or a truncated stream
     */
    public byte[] readString() throws IOException {
        int first = in.readUnsignedByte();
        int kind = (first & 0xC0) >> 6;
        if (kind != RdbConstants.LEN_ENCVAL) {
            long length = readLengthBody(first, kind);
            if (length > Integer.MAX_VALUE - 8) {
                throw new IOException("String too long: " + length);
            }
            return readBytes((int) length);
        }

        long number;
        switch (first & 0x3F) {
            case RdbConstants.ENC_INT8:
                number = in.readByte();
                break;
            case RdbConstants.ENC_INT16:
                number = (short) (in.readUnsignedByte() | (in.readUnsignedByte() << 8));
                break;
            case RdbConstants.ENC_INT32:
                number = readInt32LE();
                break;
            case RdbConstants.ENC_LZF:
                throw new IOException("LZF compressed strings are not supported");
            default:
                throw new IOException("Unknown string encoding: " + (first & 0x3F));
        }
        return Long.toString(number).getBytes(StandardCharsets.US_ASCII);
    }

    /**
     * Read a 4 byte little-endian signed integer.
     */
    public int readInt32LE() throws IOException {
        int b0 = in.readUnsignedByte();
        int b1 = in.readUnsignedByte();
        int b2 = in.readUnsignedByte();
        int b3 = in.readUnsignedByte();
        return b0 | (b1 << 8) | (b2 << 16) | (b3 << 24);
    }

    /**
     * Read a 4 byte little-endian unsigned integer.
     */
    public long readUInt32LE() throws IOException {
        return readInt32LE() & 0xFFFFFFFFL;
    }

    /**
     * Read an 8 byte little-endian integer.
     */
    public long readInt64LE() throws IOException {
        long low = readUInt32LE();
        long high = readUInt32LE();
        return low | (high << 32);
    }
}
