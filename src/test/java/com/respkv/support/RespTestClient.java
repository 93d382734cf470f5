package com.respkv.support;

import com.respkv.network.protocol.DecodeResult;
import com.respkv.network.protocol.RespCodec;
import com.respkv.network.protocol.RespValue;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Blocking RESP client for integration tests.
 */
public class RespTestClient implements AutoCloseable {

    private static final int TIMEOUT_MS = 5000;

    private final Socket socket;
    private final InputStream in;
    private final OutputStream out;
    private byte[] pending = new byte[8192];
    private int pendingLength;

    public RespTestClient(String host, int port) throws IOException {
        this.socket = new Socket(host, port);
        this.socket.setSoTimeout(TIMEOUT_MS);
        this.socket.setTcpNoDelay(true);
        this.in = socket.getInputStream();
        this.out = socket.getOutputStream();
    }

    /**
     * Send a command and wait for its reply.
     */
    public RespValue call(String... parts) throws IOException {
        send(parts);
        return readReply();
    }

    public void send(String... parts) throws IOException {
        sendRaw(RespCodec.encodeToBytes(RespValue.command(parts)));
    }

    public void sendRaw(byte[] bytes) throws IOException {
        out.write(bytes);
        out.flush();
    }

    public void sendRaw(String text) throws IOException {
        sendRaw(text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Read exactly one reply.
     *
     * @throws EOFException if the server closes the connection first
     */
    public RespValue readReply() throws IOException {
        while (true) {
            DecodeResult result = RespCodec.decode(ByteBuffer.wrap(pending, 0, pendingLength));
            if (result.isComplete()) {
                int consumed = result.getBytesConsumed();
                System.arraycopy(pending, consumed, pending, 0, pendingLength - consumed);
                pendingLength -= consumed;
                return result.getValue();
            }
            fill();
        }
    }

    /**
     * Wait for the server to close the connection, discarding any replies.
     *
     * @return true if end of stream was observed before the read timeout
     */
    public boolean awaitClose() throws IOException {
        try {
            while (true) {
                fill();
            }
        } catch (EOFException e) {
            return true;
        } catch (SocketTimeoutException e) {
            return false;
        } catch (IOException e) {
            // Connection reset also means closed
            return true;
        }
    }

    private void fill() throws IOException {
        if (pendingLength == pending.length) {
            pending = Arrays.copyOf(pending, pending.length * 2);
        }
        int read = in.read(pending, pendingLength, pending.length - pendingLength);
        if (read == -1) {
            throw new EOFException("Server closed the connection");
        }
        pendingLength += read;
    }

    @Override
    public void close() throws IOException {
        socket.close();
    }
}
