package com.github.commodityvar;

import com.github.commodityvar.dto.PositionRecord;
import com.github.commodityvar.dto.PriceRecord;
import com.github.commodityvar.market.InstrumentKey;
import com.github.commodityvar.market.MaturityLabels;
import com.github.commodityvar.market.PriceQuote;
import com.github.commodityvar.market.UnitNormalizer;
import com.github.commodityvar.portfolio.Position;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Validates incoming records once and turns them into normalized domain records.
 * Malformed input fails the whole request with an {@link IllegalArgumentException}
 * naming the offending record.
 */
public class RiskInputMapper {

    private final UnitNormalizer normalizer;

    public RiskInputMapper(UnitNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    public List<Position> toPositions(List<PositionRecord> records) {
        if (records == null) {
            return List.of();
        }
        List<Position> positions = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            positions.add(toPosition(records.get(i), "positions[" + i + "]"));
        }
        return positions;
    }

    public List<PriceQuote> toQuotes(List<PriceRecord> records) {
        if (records == null) {
            return List.of();
        }
        List<PriceQuote> quotes = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            quotes.add(toQuote(records.get(i), "prices[" + i + "]"));
        }
        return quotes;
    }

    Position toPosition(PositionRecord record, String path) {
        require(record != null, path, "record is missing");
        InstrumentKey key = key(record.metal(), record.maturityMonthLabel(), record.maturity(), record.exchange(), path);
        double volume = finite(record.volume(), path, "volume");
        double massVolume = normalizer.massVolume(volume, record.unit());
        double signedVolume = normalizer.signedVolume(massVolume, record.longShort());
        return new Position(
                key,
                trim(record.contractType()),
                trim(record.businessLine()),
                trim(record.strategy()),
                trim(record.currency()),
                trim(record.longShort()),
                volume,
                trim(record.unit()),
                massVolume,
                signedVolume
        );
    }

    PriceQuote toQuote(PriceRecord record, String path) {
        require(record != null, path, "record is missing");
        InstrumentKey key = key(record.metal(), record.maturityMonthLabel(), record.maturity(), record.exchange(), path);
        require(record.quoteDate() != null, path, "quoteDate is missing");
        double quoteValue = finite(record.quoteValue(), path, "quoteValue");
        return new PriceQuote(key, record.quoteDate(), quoteValue, trim(record.unit()),
                normalizer.massQuote(quoteValue, record.unit()));
    }

    private static InstrumentKey key(String metal, String label, LocalDate maturity, String exchange, String path) {
        require(!isBlank(metal), path, "metal is missing");
        require(!isBlank(exchange), path, "exchange is missing");
        String maturityMonth;
        if (!isBlank(label)) {
            maturityMonth = label.trim();
        } else {
            require(maturity != null, path, "maturityMonthLabel or maturity is required");
            maturityMonth = MaturityLabels.of(maturity);
        }
        return new InstrumentKey(metal.trim(), maturityMonth, exchange.trim());
    }

    private static double finite(Double value, String path, String field) {
        require(value != null, path, field + " is missing");
        require(Double.isFinite(value), path, field + " must be finite but was " + value);
        return value;
    }

    private static void require(boolean condition, String path, String message) {
        if (!condition) {
            throw new IllegalArgumentException(path + ": " + message);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String trim(String value) {
        return value != null ? value.trim() : null;
    }
}
