package com.grantradar.catalog.classify;

import com.grantradar.config.RadarProperties.HostMatch;

import java.util.Locale;

/**
 * Maps a URL host to a jurisdiction, either by substring or by suffix.
 */
public record JurisdictionRule(HostMatch match, String value, String jurisdiction) {

    public boolean matches(String netloc) {
        if (netloc == null || netloc.isEmpty() || value == null || value.isEmpty()) {
            return false;
        }
        String host = netloc.toLowerCase(Locale.ROOT);
        String needle = value.toLowerCase(Locale.ROOT);
        return match == HostMatch.SUFFIX ? host.endsWith(needle) : host.contains(needle);
    }
}
