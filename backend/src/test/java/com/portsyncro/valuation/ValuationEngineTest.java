package com.portsyncro.valuation;

import com.portsyncro.domain.ExchangeRate;
import com.portsyncro.domain.Market;
import com.portsyncro.domain.Position;
import com.portsyncro.domain.PriceCurrency;
import com.portsyncro.domain.PriceSource;
import com.portsyncro.domain.ResolvedPrice;
import com.portsyncro.domain.Valuation;
import com.portsyncro.domain.ValuationError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ValuationEngineTest {

    private static final Instant NOW = Instant.parse("2025-01-15T03:00:00Z");
    private static final ExchangeRate RATE = new ExchangeRate(new BigDecimal("16000"), "test", NOW);

    private final ValuationEngine engine = new ValuationEngine();

    @Nested
    class DomesticStocks {

        @Test
        @DisplayName("2 lots at 5500 with avg 5000 values at 1,100,000 IDR with 10% gain")
        void workedExample() {
            Position bbca = Position.stock("BBCA", Market.DOMESTIC, new BigDecimal("2"), new BigDecimal("5000"));

            Valuation v = engine.value(bbca, price("5500", PriceCurrency.IDR), RATE);

            assertThat(v.valueIdr()).isEqualByComparingTo("1100000");
            assertThat(v.valueUsd()).isEqualByComparingTo("68.75");
            assertThat(v.costBasisIdr()).isEqualByComparingTo("1000000");
            assertThat(v.gainIdr()).isEqualByComparingTo("100000");
            assertThat(v.gainUsd()).isEqualByComparingTo("6.25");
            assertThat(v.gainPercent()).isEqualByComparingTo("10.00");
            assertThat(v.error()).isNull();
        }

        @Test
        @DisplayName("missing rate keeps IDR figures and zeroes USD")
        void missingRate() {
            Position bbca = Position.stock("BBCA", Market.DOMESTIC, BigDecimal.ONE, new BigDecimal("10000"));

            Valuation noRate = engine.value(bbca, price("11000", PriceCurrency.IDR), null);
            Valuation zeroRate = engine.value(bbca, price("11000", PriceCurrency.IDR),
                    new ExchangeRate(BigDecimal.ZERO, "broken", NOW));

            for (Valuation v : new Valuation[]{noRate, zeroRate}) {
                assertThat(v.valueIdr()).isEqualByComparingTo("1100000");
                assertThat(v.valueUsd()).isZero();
                assertThat(v.gainUsd()).isZero();
                assertThat(v.error()).isEqualTo(ValuationError.EXCHANGE_RATE_UNAVAILABLE);
            }
        }

        @Test
        @DisplayName("no price gives an all-zero valuation flagged PRICE_UNAVAILABLE")
        void missingPrice() {
            Position bbca = Position.stock("BBCA", Market.DOMESTIC, BigDecimal.ONE, new BigDecimal("10000"));

            Valuation v = engine.value(bbca, null, RATE);

            assertThat(v.isPriceUnavailable()).isTrue();
            assertThat(v.valueIdr()).isZero();
            assertThat(v.costBasisIdr()).isZero();
        }

        @Test
        @DisplayName("a holding saved without a market is an IDX holding in lots")
        void missingMarketDefaultsToDomestic() {
            Position bbca = Position.stock("BBCA", null, new BigDecimal("2"), new BigDecimal("5000"));

            Valuation v = engine.value(bbca, price("5500", PriceCurrency.IDR), RATE);

            assertThat(bbca.priceKey()).isEqualTo("BBCA.JK");
            assertThat(ValuationEngine.nativeCurrency(bbca)).isEqualTo(PriceCurrency.IDR);
            assertThat(v.valueIdr()).isEqualByComparingTo("1100000");
            assertThat(v.gainPercent()).isEqualByComparingTo("10.00");
        }

        @Test
        @DisplayName("a holding without a market but traded in USD is a foreign holding in shares")
        void missingMarketWithUsdCurrencyIsForeign() {
            Position aapl = Position.stock("AAPL", null, new BigDecimal("3"), new BigDecimal("150"));
            aapl.setCurrency(PriceCurrency.USD);

            Valuation v = engine.value(aapl, price("200", PriceCurrency.USD), RATE);

            assertThat(aapl.priceKey()).isEqualTo("AAPL");
            assertThat(v.valueUsd()).isEqualByComparingTo("600.00");
            assertThat(v.valueIdr()).isEqualByComparingTo("9600000");
        }

        @Test
        @DisplayName("manual IDX price values the lots without a fetched price")
        void manualPrice() {
            Position bbca = Position.stock("BBCA", Market.DOMESTIC, new BigDecimal("2"), new BigDecimal("5000"));
            bbca.setManualPrice(new BigDecimal("5500"));

            Valuation withoutFetched = engine.value(bbca, null, RATE);
            Valuation withFetched = engine.value(bbca, price("9999", PriceCurrency.IDR), RATE);

            assertThat(withoutFetched.isPriceUnavailable()).isFalse();
            assertThat(withoutFetched.valueIdr()).isEqualByComparingTo("1100000");
            assertThat(withFetched.priceUsed()).isEqualByComparingTo("5500");
            assertThat(withFetched.valueIdr()).isEqualByComparingTo("1100000");
        }
    }

    @Test
    @DisplayName("crypto is native USD and bridged to IDR")
    void crypto() {
        Position btc = Position.crypto("BTC", new BigDecimal("0.5"), new BigDecimal("40000"));

        Valuation v = engine.value(btc, price("50000", PriceCurrency.USD), RATE);

        assertThat(v.valueUsd()).isEqualByComparingTo("25000.00");
        assertThat(v.valueIdr()).isEqualByComparingTo("400000000");
        assertThat(v.costBasisIdr()).isEqualByComparingTo("320000000");
        assertThat(v.gainIdr()).isEqualByComparingTo("80000000");
        assertThat(v.gainUsd()).isEqualByComparingTo("5000.00");
        assertThat(v.gainPercent()).isEqualByComparingTo("25.00");
    }

    @Test
    @DisplayName("manual crypto price replaces the fetched one and works without a fetched price")
    void manualCryptoPrice() {
        Position token = Position.crypto("MYTOKEN", new BigDecimal("10"), new BigDecimal("1"));
        token.setManualPrice(new BigDecimal("2"));

        Valuation withFetched = engine.value(token, price("99", PriceCurrency.USD), RATE);
        Valuation withoutFetched = engine.value(token, null, RATE);

        assertThat(withFetched.valueUsd()).isEqualByComparingTo("20.00");
        assertThat(withFetched.priceUsed()).isEqualByComparingTo("2");
        assertThat(withoutFetched.valueUsd()).isEqualByComparingTo("20.00");
        assertThat(withoutFetched.gainPercent()).isEqualByComparingTo("100.00");
    }

    @Test
    @DisplayName("gold grams are valued in IDR per gram")
    void gold() {
        Position antam = Position.gold("GOLD:ANTAM", new BigDecimal("5"), new BigDecimal("1000000"));

        Valuation v = engine.value(antam, price("1162500", PriceCurrency.IDR), RATE);

        assertThat(v.valueIdr()).isEqualByComparingTo("5812500");
        assertThat(v.valueUsd()).isEqualByComparingTo("363.28");
        assertThat(v.gainIdr()).isEqualByComparingTo("812500");
        assertThat(v.gainPercent()).isEqualByComparingTo("16.25");
    }

    @Test
    @DisplayName("manual gold price per gram replaces the fetched one")
    void manualGoldPrice() {
        Position antam = Position.gold("GOLD:ANTAM", new BigDecimal("5"), new BigDecimal("1000000"));
        antam.setManualPrice(new BigDecimal("1200000"));

        Valuation v = engine.value(antam, null, RATE);

        assertThat(v.isPriceUnavailable()).isFalse();
        assertThat(v.valueIdr()).isEqualByComparingTo("6000000");
        assertThat(v.gainIdr()).isEqualByComparingTo("1000000");
        assertThat(v.gainPercent()).isEqualByComparingTo("20.00");
    }

    @Test
    @DisplayName("foreign stock units are shares, not lots")
    void foreignStock() {
        Position aapl = Position.stock("AAPL", Market.FOREIGN, new BigDecimal("3"), new BigDecimal("150"));

        Valuation v = engine.value(aapl, price("200", PriceCurrency.USD), RATE);

        assertThat(v.valueUsd()).isEqualByComparingTo("600.00");
        assertThat(v.valueIdr()).isEqualByComparingTo("9600000");
        assertThat(v.gainPercent()).isEqualByComparingTo("33.33");
    }

    @Test
    @DisplayName("cash is face value in both currencies with no cost or gain")
    void cash() {
        Valuation idr = engine.value(Position.cash("Bank", PriceCurrency.IDR, new BigDecimal("1000000")), null, RATE);
        Valuation usd = engine.value(Position.cash("Wallet", PriceCurrency.USD, new BigDecimal("100")), null, RATE);

        assertThat(idr.valueIdr()).isEqualByComparingTo("1000000");
        assertThat(idr.valueUsd()).isEqualByComparingTo("62.50");
        assertThat(idr.costBasisIdr()).isZero();
        assertThat(idr.gainIdr()).isZero();
        assertThat(usd.valueIdr()).isEqualByComparingTo("1600000");
        assertThat(usd.valueUsd()).isEqualByComparingTo("100.00");
        assertThat(usd.error()).isNull();
    }

    @Test
    @DisplayName("zero cost basis gives a zero gain percent")
    void zeroCost() {
        Position airdrop = Position.crypto("ARB", new BigDecimal("100"), BigDecimal.ZERO);

        Valuation v = engine.value(airdrop, price("1.25", PriceCurrency.USD), RATE);

        assertThat(v.valueUsd()).isEqualByComparingTo("125.00");
        assertThat(v.gainPercent()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("native currency follows the asset class")
    void nativeCurrency() {
        assertThat(ValuationEngine.nativeCurrency(Position.stock("BBCA", Market.DOMESTIC, BigDecimal.ONE, BigDecimal.ONE)))
                .isEqualTo(PriceCurrency.IDR);
        assertThat(ValuationEngine.nativeCurrency(Position.stock("AAPL", Market.FOREIGN, BigDecimal.ONE, BigDecimal.ONE)))
                .isEqualTo(PriceCurrency.USD);
        assertThat(ValuationEngine.nativeCurrency(Position.gold("GOLD", BigDecimal.ONE, BigDecimal.ONE)))
                .isEqualTo(PriceCurrency.IDR);
        assertThat(ValuationEngine.nativeCurrency(Position.cash("x", PriceCurrency.USD, BigDecimal.ONE)))
                .isEqualTo(PriceCurrency.USD);
    }

    private static ResolvedPrice price(String value, PriceCurrency currency) {
        return ResolvedPrice.of(new BigDecimal(value), currency, BigDecimal.ZERO, PriceSource.YAHOO_QUOTE, NOW);
    }
}
