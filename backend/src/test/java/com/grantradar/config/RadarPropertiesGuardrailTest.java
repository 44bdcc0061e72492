package com.grantradar.config;

import org.junit.jupiter.api.Test;

import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RadarPropertiesGuardrailTest {

    @Test
    void localityFallsBackToDefault() {
        RadarProperties properties = new RadarProperties();
        properties.setLocality("   ");
        assertEquals("Wyndham", properties.getLocality());
    }

    @Test
    void windowsAndParallelismAreClamped() {
        RadarProperties properties = new RadarProperties();
        properties.setClosingWindowDays(0);
        properties.setRecentDays(-3);
        properties.getEnrichment().setParallelism(0);
        properties.getDigest().setLimit(-1);
        assertEquals(1, properties.getClosingWindowDays());
        assertEquals(0, properties.getRecentDays());
        assertEquals(1, properties.getEnrichment().getParallelism());
        assertEquals(1, properties.getDigest().getLimit());

        properties.setClosingWindowDays(10_000);
        assertEquals(365, properties.getClosingWindowDays());
    }

    @Test
    void invalidZoneFallsBackToMelbourne() {
        RadarProperties properties = new RadarProperties();
        properties.setZone("Not/AZone");
        assertEquals(ZoneId.of("Australia/Melbourne"), properties.getZoneId());
    }

    @Test
    void defaultRuleTablesAreOrdered() {
        RadarProperties.Rules rules = new RadarProperties().getRules();
        assertEquals("community", rules.getAudience().keySet().iterator().next());
        assertEquals("Commonwealth", rules.getJurisdictions().get(0).getJurisdiction());
        assertTrue(rules.getDiscipline().containsKey("environment"));
    }
}
