package com.questrail.cot.config;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CotConfigTest {

    @Test
    void cotUrlFallsBackToDefaultMulticastGroup() {
        CotConfig config = CotConfig.of("endpoint", Map.of());

        assertEquals("udp+wo://239.2.3.1:6969", config.cotUrl());
    }

    @Test
    void blankValuesAreTreatedAsAbsent() {
        CotConfig config = CotConfig.of("endpoint", Map.of(CotConfigKeys.TLS_CLIENT_KEY, "   "));

        assertTrue(config.get(CotConfigKeys.TLS_CLIENT_KEY).isEmpty());
        assertFalse(config.contains(CotConfigKeys.TLS_CLIENT_KEY));
    }

    @Test
    void booleanTruthValuesAreCaseInsensitive() {
        for (String truthy : new String[] { "true", "YES", "y", "On", "1" }) {
            CotConfig config = CotConfig.builder("t").put(CotConfigKeys.FTS_COMPAT, truthy).build();
            assertTrue(config.getBoolean(CotConfigKeys.FTS_COMPAT), truthy);
        }
        for (String falsy : new String[] { "false", "0", "off", "nope" }) {
            CotConfig config = CotConfig.builder("t").put(CotConfigKeys.FTS_COMPAT, falsy).build();
            assertFalse(config.getBoolean(CotConfigKeys.FTS_COMPAT), falsy);
        }
        assertFalse(CotConfig.of("t", Map.of()).getBoolean(CotConfigKeys.FTS_COMPAT));
    }

    @Test
    void getIntParsesOrFallsBack() {
        CotConfig config = CotConfig.builder("t").put(CotConfigKeys.MAX_OUT_QUEUE, 7).build();

        assertEquals(7, config.getInt(CotConfigKeys.MAX_OUT_QUEUE, 100));
        assertEquals(500, config.getInt(CotConfigKeys.MAX_IN_QUEUE, 500));
    }

    @Test
    void getIntRejectsNonNumericValue() {
        CotConfig config = CotConfig.builder("t").put(CotConfigKeys.TAK_PROTO, "one").build();

        CotConfigurationException e = assertThrows(CotConfigurationException.class,
                () -> config.getInt(CotConfigKeys.TAK_PROTO, 0));
        assertTrue(e.getMessage().contains(CotConfigKeys.TAK_PROTO));
    }

    @Test
    void sourceMapChangesDoNotLeakIn() {
        Map<String, String> source = new HashMap<>();
        source.put(CotConfigKeys.COT_URL, "tcp://a:1");
        CotConfig config = CotConfig.of("t", source);

        source.put(CotConfigKeys.COT_URL, "tcp://b:2");

        assertEquals("tcp://a:1", config.cotUrl());
        assertThrows(UnsupportedOperationException.class, () -> config.asMap().put("X", "Y"));
    }

    @Test
    void withOverridesReturnsNewInstance() {
        CotConfig base = CotConfig.builder("t").withCotUrl("tcp://a:1").build();
        CotConfig overridden = base.withOverrides(Map.of(CotConfigKeys.COT_URL, "udp://b:2"));

        assertEquals("tcp://a:1", base.cotUrl());
        assertEquals("udp://b:2", overridden.cotUrl());
        assertEquals("t", overridden.name());
    }
}
