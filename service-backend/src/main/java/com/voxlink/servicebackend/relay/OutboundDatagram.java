package com.voxlink.servicebackend.relay;

import java.net.InetSocketAddress;

public record OutboundDatagram(byte[] payload, InetSocketAddress target) {
}
