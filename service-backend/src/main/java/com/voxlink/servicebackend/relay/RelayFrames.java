package com.voxlink.servicebackend.relay;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Building and splitting {@code X|field|field...} datagrams.
 */
public final class RelayFrames {
    private RelayFrames() {
    }

    /**
     * Splits the text after the tag on {@code |}. Empty fields are kept.
     */
    public static List<String> textFields(byte[] data, int length) {
        String text = new String(data, 2, length - 2, StandardCharsets.UTF_8);
        List<String> fields = new ArrayList<>();
        int start = 0;
        int idx;
        while ((idx = text.indexOf('|', start)) >= 0) {
            fields.add(text.substring(start, idx).trim());
            start = idx + 1;
        }
        fields.add(text.substring(start).trim());
        return fields;
    }

    public static int indexOf(byte[] data, int length, byte value, int from) {
        for (int i = from; i < length; i++) {
            if (data[i] == value) {
                return i;
            }
        }
        return -1;
    }

    public static byte[] text(RelayPacketType type, String... fields) {
        StringBuilder sb = new StringBuilder();
        sb.append((char) type.tag());
        for (String field : fields) {
            sb.append('|').append(field);
        }
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }

    /**
     * {@code X|header|} followed by a binary tail.
     */
    public static byte[] withTail(RelayPacketType type, String header, byte[] tail, int tailOffset, int tailLength) {
        byte[] head = (((char) type.tag()) + "|" + header + "|").getBytes(StandardCharsets.UTF_8);
        byte[] out = new byte[head.length + tailLength];
        System.arraycopy(head, 0, out, 0, head.length);
        System.arraycopy(tail, tailOffset, out, head.length, tailLength);
        return out;
    }
}
