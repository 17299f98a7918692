package com.github.commodityvar.portfolio;

import com.github.commodityvar.market.PriceQuote;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.github.commodityvar.TestData.*;
import static org.assertj.core.api.Assertions.*;

class PriceJoinerTest {

    private final Position copper = longPosition(COPPER_OCT, 100);
    private final Position zinc = shortPosition(ZINC_OCT, 50);
    private final Position lead = longPosition(LEAD_DEC, 10);

    @Nested
    @DisplayName("Latest quote")
    class Latest {

        @Test
        void picksMostRecentQuotePerInstrument() {
            PriceJoiner joiner = PriceJoiner.over(List.of(
                    quote(COPPER_OCT, START.plusDays(2), 9100),
                    quote(COPPER_OCT, START, 9000),
                    quote(ZINC_OCT, START.plusDays(1), 2600),
                    quote(COPPER_OCT, START.plusDays(1), 9050)));

            List<PricedPosition> priced = joiner.joinLatest(List.of(copper, zinc));

            assertThat(priced.get(0).massPrice()).hasValue(9100.0);
            assertThat(priced.get(0).priceDate()).hasValue(START.plusDays(2));
            assertThat(priced.get(1).massPrice()).hasValue(2600.0);
        }

        @Test
        void sameDayTieGoesToLastRow() {
            PriceJoiner joiner = PriceJoiner.over(List.of(
                    quote(COPPER_OCT, START, 9000),
                    quote(COPPER_OCT, START, 9010),
                    quote(COPPER_OCT, START, 9020)));

            assertThat(joiner.joinLatest(List.of(copper)).get(0).massPrice()).hasValue(9020.0);
        }

        @Test
        void horizonBoundsSelectedDate() {
            PriceJoiner joiner = PriceJoiner.over(List.of(
                    quote(COPPER_OCT, START, 9000),
                    quote(COPPER_OCT, START.plusDays(5), 9500)));

            assertThat(joiner.joinLatest(List.of(copper), START.plusDays(4)).get(0).massPrice()).hasValue(9000.0);
            assertThat(joiner.joinLatest(List.of(copper), START.minusDays(1)).get(0).isPriced()).isFalse();
        }

        @Test
        void missingInstrumentStaysUnpricedNotZero() {
            PriceJoiner joiner = PriceJoiner.over(List.of(quote(COPPER_OCT, START, 9000)));

            PricedPosition priced = joiner.joinLatest(List.of(lead)).get(0);

            assertThat(priced.isPriced()).isFalse();
            assertThat(priced.massPrice()).isEmpty();
            assertThatThrownBy(priced::signedValue).isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("Exact date")
    class ExactDate {

        private final List<PriceQuote> quotes = List.of(
                quote(COPPER_OCT, START, 9000),
                quote(COPPER_OCT, START.plusDays(1), 9050),
                quote(ZINC_OCT, START.plusDays(1), 2600),
                quote(ZINC_OCT, START.plusDays(1), 2610));

        @Test
        void matchesOnlyTheRequestedDate() {
            List<PricedPosition> priced = PriceJoiner.over(quotes).joinOn(List.of(copper, zinc), START);

            assertThat(priced.get(0).massPrice()).hasValue(9000.0);
            assertThat(priced.get(1).isPriced()).isFalse();
        }

        @Test
        void sameDayDuplicatesResolveToLastRow() {
            List<PricedPosition> priced = PriceJoiner.over(quotes).joinOn(List.of(zinc), START.plusDays(1));

            assertThat(priced.get(0).massPrice()).hasValue(2610.0);
        }

        @Test
        void signedValueUsesSignedVolume() {
            PricedPosition priced = PriceJoiner.over(quotes).joinOn(List.of(zinc), START.plusDays(1)).get(0);

            assertThat(priced.signedValue()).isEqualTo(-50 * 2610.0);
        }
    }

    @Test
    void distinctDatesSpanAllInstrumentsInOrder() {
        PriceJoiner joiner = PriceJoiner.over(List.of(
                quote(ZINC_OCT, START.plusDays(3), 2600),
                quote(COPPER_OCT, START.plusDays(1), 9050),
                quote(COPPER_OCT, START, 9000),
                quote(ZINC_OCT, START.plusDays(1), 2590)));

        assertThat(joiner.distinctDates())
                .containsExactly(START, START.plusDays(1), START.plusDays(3));
    }
}
