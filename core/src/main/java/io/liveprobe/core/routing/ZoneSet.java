package io.liveprobe.core.routing;

import io.liveprobe.core.config.ConfigurationException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Fixed, ordered sequence of location codes used for geosharded placement.
 *
 * Order matters: assignment is index-based, so reordering the set moves documents
 * between zones.
 */
public record ZoneSet(List<String> zones) {

    /** ISO 3166 alpha-2 codes used when no zones are configured. */
    private static final List<String> DEFAULT_ZONES = List.of(
            "US", "CA", "GB", "DE", "FR", "IN", "JP", "CN", "BR", "AU",
            "SG", "NL", "SE", "CH", "IT", "ES", "MX", "KR", "ZA", "AE"
    );

    public ZoneSet {
        if (zones == null || zones.isEmpty()) {
            throw new ConfigurationException("zone set must not be empty");
        }
        Set<String> seen = new HashSet<>();
        for (String z : zones) {
            if (z == null || z.isBlank()) {
                throw new ConfigurationException("zone codes must not be blank");
            }
            if (!seen.add(z)) {
                throw new ConfigurationException("duplicate zone code: " + z);
            }
        }
        zones = List.copyOf(zones);
    }

    public static ZoneSet defaults() {
        return new ZoneSet(DEFAULT_ZONES);
    }

    /** Parse "US,DE,JP"; blank entries are skipped. */
    public static ZoneSet parse(String csv) {
        if (csv == null || csv.isBlank()) {
            return defaults();
        }
        List<String> out = new ArrayList<>();
        for (String raw : csv.split(",")) {
            String z = raw.trim();
            if (!z.isEmpty()) {
                out.add(z);
            }
        }
        return new ZoneSet(out);
    }

    public int size() {
        return zones.size();
    }

    public String get(int index) {
        return zones.get(index);
    }
}
