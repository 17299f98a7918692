package com.github.commodityvar.market;

import org.jboss.logging.Logger;

import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Converts volumes and quotes to metric tons and applies the long/short sign.
 * <p>
 * Units missing from the tables pass through with factor 1.0. That policy hides
 * typos such as {@code LBS}, so every unrecognized unit is logged once and kept in
 * {@link #unrecognizedUnits()} for the run report.
 * <p>
 * Side tags are matched ignoring case and padding, and the spelled-out {@code LONG}
 * and {@code SHORT} are accepted next to {@code L} and {@code S}. A strict reading
 * where only the exact tag {@code L} is long would book {@code LONG} or {@code l}
 * as short; here they are long.
 */
public class UnitNormalizer {

    private static final Logger LOG = Logger.getLogger(UnitNormalizer.class);

    private static final double PASS_THROUGH = 1.0;

    private final UnitTable positionUnits;
    private final UnitTable priceUnits;

    private final Set<String> unrecognizedUnits = ConcurrentHashMap.newKeySet();
    private final Set<String> ambiguousSideTags = ConcurrentHashMap.newKeySet();

    public UnitNormalizer(UnitTable positionUnits, UnitTable priceUnits) {
        this.positionUnits = positionUnits;
        this.priceUnits = priceUnits;
    }

    public static UnitNormalizer withDefaults() {
        return new UnitNormalizer(UnitTable.defaultPositionUnits(), UnitTable.defaultPriceUnits());
    }

    public double massVolume(double volume, String unit) {
        return volume * positionFactor(unit);
    }

    /**
     * Inverse of {@link #massVolume(double, String)}.
     */
    public double volumeFromMass(double massVolume, String unit) {
        return massVolume / positionFactor(unit);
    }

    public double massQuote(double quote, String unit) {
        return quote / priceFactor(unit);
    }

    /**
     * Long positions ({@code L}, {@code LONG}, any case) keep their sign, everything
     * else is treated as short.
     */
    public double signedVolume(double massVolume, String longShort) {
        Side side = Side.of(longShort);
        if (side == Side.UNKNOWN) {
            if (ambiguousSideTags.add(String.valueOf(longShort))) {
                LOG.warnf("Long/short tag '%s' is neither long nor short, treating it as short", longShort);
            }
        }
        return side == Side.LONG ? massVolume : -massVolume;
    }

    public double positionFactor(String unit) {
        return resolve(positionUnits, unit, "position");
    }

    public double priceFactor(String unit) {
        return resolve(priceUnits, unit, "price");
    }

    public Set<String> unrecognizedUnits() {
        return new TreeSet<>(unrecognizedUnits);
    }

    public Set<String> ambiguousSideTags() {
        return new TreeSet<>(ambiguousSideTags);
    }

    private double resolve(UnitTable table, String unit, String kind) {
        var factor = table.factor(unit);
        if (factor.isPresent()) {
            return factor.getAsDouble();
        }
        if (unrecognizedUnits.add(String.valueOf(unit))) {
            LOG.warnf("Unrecognized %s unit '%s', passing values through unconverted", kind, unit);
        }
        return PASS_THROUGH;
    }

    enum Side {
        LONG, SHORT, UNKNOWN;

        static Side of(String tag) {
            if (tag == null) {
                return UNKNOWN;
            }
            return switch (tag.trim().toUpperCase(Locale.ROOT)) {
                case "L", "LONG" -> LONG;
                case "S", "SHORT" -> SHORT;
                default -> UNKNOWN;
            };
        }
    }
}
