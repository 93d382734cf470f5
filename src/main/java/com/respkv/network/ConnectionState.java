package com.respkv.network;

/**
 * Lifecycle of a client connection on the event loop.
 */
public enum ConnectionState {
    /** Waiting for request bytes. */
    READING,
    /** Decoding and executing buffered requests. */
    PROCESSING,
    /** Replies are queued that the socket has not accepted yet. */
    WRITING,
    /** Closed or being closed; no further I/O. */
    CLOSING
}
