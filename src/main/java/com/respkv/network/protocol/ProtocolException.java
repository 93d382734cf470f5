package com.respkv.network.protocol;

/**
 * Exception thrown when a frame violates the RESP grammar.
 * Fatal to the connection that produced it.
 */
public class ProtocolException extends RuntimeException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
