package com.voxlink.servicebackend.relay;

/**
 * Datagram kinds, identified by the first byte of a {@code X|} tag.
 */
public enum RelayPacketType {
    JOIN('J', true),
    ROOM_JOIN('C', true),
    ROOM_LEAVE('L', true),
    SET_PAIR('S', true),
    PING('P', true),
    PONG('Q', false),
    AUDIO('A', false),
    RELAYED_AUDIO('R', false);

    public static final byte SEPARATOR = '|';

    private final byte tag;
    private final boolean control;

    RelayPacketType(char tag, boolean control) {
        this.tag = (byte) tag;
        this.control = control;
    }

    public byte tag() {
        return tag;
    }

    /**
     * Control kinds are rate-limited at the relay; audio is not.
     */
    public boolean control() {
        return control;
    }

    /**
     * @return the type of a datagram carrying a tag and at least one payload byte, or null
     */
    public static RelayPacketType of(byte[] data, int length) {
        if (length < 3 || data[1] != SEPARATOR) {
            return null;
        }
        for (RelayPacketType type : values()) {
            if (type.tag == data[0]) {
                return type;
            }
        }
        return null;
    }
}
