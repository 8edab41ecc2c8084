package com.msp.forecast.series;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.Locale;

/**
 * Normalized identity of a modeled price series: (commodity, region, market | "all").
 * Two keys built from names differing only in case or whitespace are equal.
 * The names as supplied are kept for display and for re-querying the store.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SeriesKey {

    public static final String ALL_MARKETS = "all";

    String commodity;
    String region;
    String market;

    @EqualsAndHashCode.Exclude
    String commodityName;
    @EqualsAndHashCode.Exclude
    String regionName;

    /**
     * Null when the key covers all markets.
     */
    @EqualsAndHashCode.Exclude
    String marketName;

    public static SeriesKey of(String commodity, String region, String market) {
        boolean allMarkets = market == null || market.isBlank();
        return new SeriesKey(
                requireName(commodity, "commodity"),
                requireName(region, "region"),
                allMarkets ? ALL_MARKETS : normalize(market),
                commodity.trim(),
                region.trim(),
                allMarkets ? null : market.trim());
    }

    public boolean coversAllMarkets() {
        return ALL_MARKETS.equals(market);
    }

    /**
     * Storage key, e.g. {@code wheat_uttar_pradesh_all}.
     */
    public String asString() {
        return commodity + "_" + region + "_" + market;
    }

    @Override
    public String toString() {
        return asString();
    }

    static String normalize(String value) {
        return value.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", "_");
    }

    private static String requireName(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return normalize(value);
    }
}
