package com.github.commodityvar.portfolio;

import com.github.commodityvar.market.InstrumentKey;

/**
 * One book entry after unit normalization.
 *
 * @param key          Instrument the position is held in
 * @param contractType Contract type, e.g. {@code Future}
 * @param businessLine Business line owning the position
 * @param strategy     Trading strategy tag
 * @param currency     Settlement currency
 * @param longShort    Raw long/short tag as received
 * @param volume       Raw volume in {@code unit}
 * @param unit         Volume unit, e.g. {@code LB}
 * @param massVolume   Volume in metric tons, always non-negative for non-negative input
 * @param signedVolume Mass volume with the long/short sign applied
 */
public record Position(
        InstrumentKey key,
        String contractType,
        String businessLine,
        String strategy,
        String currency,
        String longShort,
        double volume,
        String unit,
        double massVolume,
        double signedVolume
) {
}
