package com.questrail.cot.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CotUrlTest
 * -----------------------------------------------------------------------------
 * Validates destination descriptor parsing, default ports and scheme flags.
 */
class CotUrlTest {

    @Test
    void parsesHostAndExplicitPort() {
        CotUrl url = CotUrl.parse("tcp://tak.example.com:8089");

        assertEquals("tcp", url.scheme());
        assertEquals("tak.example.com", url.host());
        assertEquals(8089, url.port());
        assertTrue(url.isTcp());
        assertFalse(url.isUdp());
    }

    @Test
    void streamFamilyDefaultsTo8087() {
        assertEquals(8087, CotUrl.parse("tcp://tak.example.com").port());
        assertEquals(8087, CotUrl.parse("tls://tak.example.com").port());
        assertEquals(8087, CotUrl.parse("udp://10.0.0.1").port());
    }

    @Test
    void broadcastAndMulticastDefaultTo6969() {
        assertEquals(6969, CotUrl.parse("udp+broadcast://255.255.255.255").port());
        assertEquals(6969, CotUrl.parse("udp+multicast://239.2.3.1").port());
    }

    @Test
    void udpModifiersAreIndependentFlags() {
        CotUrl url = CotUrl.parse("udp+multicast+wo://239.2.3.1:6969");

        assertTrue(url.isUdp());
        assertTrue(url.isMulticastScheme());
        assertTrue(url.isWriteOnly());
        assertFalse(url.isBroadcast());
    }

    @Test
    void sslIsAnAliasForTls() {
        assertTrue(CotUrl.parse("ssl://tak.example.com:8089").isTls());
        assertTrue(CotUrl.parse("tls://tak.example.com:8089").isTls());
    }

    @Test
    void bracketedIpv6LiteralKeepsPort() {
        CotUrl url = CotUrl.parse("udp://[ff02::1]:7171");

        assertEquals("ff02::1", url.host());
        assertEquals(7171, url.port());
    }

    @Test
    void bareIpv6LiteralUsesDefaultPort() {
        CotUrl url = CotUrl.parse("udp+multicast://ff02::1");

        assertEquals("ff02::1", url.host());
        assertEquals(6969, url.port());
    }

    @Test
    void fileDescriptorJoinsAuthorityAndPath() {
        CotUrl url = CotUrl.parse("file://out/dir/events.xml");

        assertTrue(url.isFile());
        assertEquals("out/dir/events.xml", url.filePath());
    }

    @Test
    void logDescriptorKeepsHost() {
        CotUrl url = CotUrl.parse("log://stderr");

        assertTrue(url.isLog());
        assertEquals("stderr", url.host());
    }

    @Test
    void missingSeparatorIsRejected() {
        CotConfigurationException e = assertThrows(CotConfigurationException.class,
                () -> CotUrl.parse("tak.example.com:8087"));
        assertTrue(e.getMessage().contains("full URL"));
    }

    @Test
    void unknownSchemeIsRejected() {
        assertThrows(CotConfigurationException.class, () -> CotUrl.parse("http://tak.example.com:8087"));
    }

    @Test
    void unknownModifierIsRejected() {
        assertThrows(CotConfigurationException.class, () -> CotUrl.parse("udp+anycast://10.0.0.1:6969"));
        assertThrows(CotConfigurationException.class, () -> CotUrl.parse("tcp+wo://10.0.0.1:6969"));
    }

    @Test
    void malformedPortIsRejected() {
        assertThrows(CotConfigurationException.class, () -> CotUrl.parse("tcp://host:abc"));
        assertThrows(CotConfigurationException.class, () -> CotUrl.parse("tcp://host:70000"));
    }
}
