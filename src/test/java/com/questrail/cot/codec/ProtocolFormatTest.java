package com.questrail.cot.codec;

import com.questrail.cot.config.CotConfig;
import com.questrail.cot.config.CotConfigKeys;
import com.questrail.cot.config.CotConfigurationException;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProtocolFormatTest {

    private static CotConfig config(String url, int takProto) {
        return CotConfig.builder("t")
                .withCotUrl(url)
                .put(CotConfigKeys.TAK_PROTO, takProto)
                .build();
    }

    @Test
    void takProtoZeroSelectsXml() {
        assertEquals(ProtocolFormat.XML, ProtocolFormat.resolve(config("udp://239.2.3.1:6969", 0)));
    }

    @Test
    void multicastLiteralSelectsMesh() {
        assertEquals(ProtocolFormat.MESH, ProtocolFormat.resolve(config("udp://239.2.3.1:6969", 1)));
    }

    @Test
    void unicastLiteralSelectsStream() {
        assertEquals(ProtocolFormat.STREAM, ProtocolFormat.resolve(config("udp://192.0.2.1:6969", 1)));
    }

    @Test
    void dnsNameSelectsStreamWithoutLookup() {
        assertEquals(ProtocolFormat.STREAM, ProtocolFormat.resolve(config("tcp://tak.invalid:8087", 1)));
        assertFalse(ProtocolFormat.isMulticastHost("tak.invalid"));
    }

    @Test
    void ipv6MulticastLiteralIsMulticast() {
        assertTrue(ProtocolFormat.isMulticastHost("ff02::1"));
        assertFalse(ProtocolFormat.isMulticastHost("::1"));
    }

    @Test
    void binaryFramingWithoutCodecFailsFast() {
        CotConfigurationException e = assertThrows(CotConfigurationException.class,
                () -> ProtocolFormat.resolve(config("udp://192.0.2.1:6969", 1), null));
        assertTrue(e.getMessage().contains(CotConfigKeys.TAK_PROTO));
    }

    @Test
    void xmlNeedsNoCodec() {
        assertEquals(ProtocolFormat.XML, ProtocolFormat.resolve(config("udp://192.0.2.1:6969", 0), null));
    }
}
