package com.voxlink.servicebackend.control;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.SocketTimeoutException;
import java.nio.ByteBuffer;
import java.util.Optional;

/**
 * Control channel framing: a 4-byte big-endian length followed by that many bytes of
 * UTF-8 JSON. Legacy clients send bare JSON with no prefix; such a body starts with
 * {@code {} or {@code [} and ends when the peer stops sending.
 */
public final class FrameCodec {
    public static final int HEADER_BYTES = 4;

    private FrameCodec() {
    }

    @FunctionalInterface
    public interface IoAction {
        void run() throws IOException;
    }

    public static byte[] encode(byte[] payload) {
        return ByteBuffer.allocate(HEADER_BYTES + payload.length)
                .putInt(payload.length)
                .put(payload)
                .array();
    }

    public static void writeFrame(OutputStream out, byte[] payload) throws IOException {
        out.write(encode(payload));
        out.flush();
    }

    /**
     * Reads one request body.
     *
     * @param beforeLegacyBody run once a legacy body is detected, before reading the rest
     *                         of it; the server shortens the socket timeout here
     * @return empty when the peer sent nothing, a bad length, or legacy JSON while legacy
     *         framing is disabled
     */
    public static Optional<byte[]> readRequest(InputStream in,
                                               int maxFrameBytes,
                                               boolean allowLegacyRawJson,
                                               IoAction beforeLegacyBody) throws IOException {
        byte[] header = readExactly(in, HEADER_BYTES);
        if (header == null) {
            return Optional.empty();
        }
        if (header[0] == '{' || header[0] == '[') {
            if (!allowLegacyRawJson) {
                return Optional.empty();
            }
            beforeLegacyBody.run();
            return Optional.of(readUntilIdle(in, header, maxFrameBytes));
        }
        int length = ByteBuffer.wrap(header).getInt();
        if (length <= 0 || length > maxFrameBytes) {
            return Optional.empty();
        }
        return Optional.ofNullable(readExactly(in, length));
    }

    /**
     * Reads one length-prefixed frame, as a client does for a response.
     *
     * @throws IOException on a truncated stream or a length outside {@code 1..maxFrameBytes}
     */
    public static byte[] readFrame(InputStream in, int maxFrameBytes) throws IOException {
        byte[] header = readExactly(in, HEADER_BYTES);
        if (header == null) {
            throw new EOFException("Connection closed before a response frame");
        }
        int length = ByteBuffer.wrap(header).getInt();
        if (length <= 0 || length > maxFrameBytes) {
            throw new IOException("Invalid frame length " + length);
        }
        byte[] body = readExactly(in, length);
        if (body == null) {
            throw new EOFException("Response frame truncated");
        }
        return body;
    }

    // null when the stream ends first
    private static byte[] readExactly(InputStream in, int n) throws IOException {
        byte[] buf = new byte[n];
        int off = 0;
        while (off < n) {
            int read = in.read(buf, off, n - off);
            if (read < 0) {
                return null;
            }
            off += read;
        }
        return buf;
    }

    private static byte[] readUntilIdle(InputStream in, byte[] prefix, int maxFrameBytes) throws IOException {
        ByteArrayOutputStream data = new ByteArrayOutputStream();
        data.write(prefix);
        byte[] chunk = new byte[64 * 1024];
        while (data.size() < maxFrameBytes) {
            int read;
            try {
                read = in.read(chunk);
            } catch (SocketTimeoutException idle) {
                break;
            }
            if (read < 0) {
                break;
            }
            data.write(chunk, 0, read);
        }
        return data.toByteArray();
    }
}
