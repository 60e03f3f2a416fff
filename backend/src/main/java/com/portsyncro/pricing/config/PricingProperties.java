package com.portsyncro.pricing.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Pricing module configuration. Documented in application.yml under portsyncro.pricing.
 */
@ConfigurationProperties(prefix = "portsyncro.pricing")
@Getter
@Setter
public class PricingProperties {

    /**
     * Google Finance base URL; quote pages live under /quote/{SYMBOL}:IDX.
     */
    private String googleFinanceBaseUrl = "https://www.google.com/finance";

    /**
     * Yahoo batch quote host (/v7/finance/quote).
     */
    private String yahooQuoteBaseUrl = "https://query1.finance.yahoo.com";

    /**
     * Yahoo chart host (/v8/finance/chart/{symbol}).
     */
    private String yahooChartBaseUrl = "https://query2.finance.yahoo.com";

    /**
     * CryptoCompare min-api base URL (/data/pricemultifull, /data/price).
     */
    private String cryptocompareBaseUrl = "https://min-api.cryptocompare.com";

    /**
     * IndoGold daily price page, scraped for the gold buy price in IDR per gram.
     */
    private String indogoldUrl = "https://www.indogold.id/harga-emas-hari-ini";

    /**
     * USD-based exchange rate endpoint; IDR is read from conversion_rates, rates or the root object.
     */
    private String exchangeRateUrl = "https://api.exchangerate-api.com/v4/latest/USD";

    /**
     * Hard timeout per upstream call in milliseconds. Cancels the in-flight exchange.
     */
    private long fetchTimeoutMs = 8000;

    /**
     * Extra attempts after the first for a single upstream call (429 and transport/HTTP failures only).
     */
    private int maxRetries = 1;

    /**
     * Backoff unit after an upstream 429; multiplied by the attempt number.
     */
    private long rateLimitedBackoffMs = 1000;

    /**
     * Fixed delay before retrying after any other non-timeout failure.
     */
    private long failureDelayMs = 500;

    /**
     * Hard cap of unique instruments per category (stocks, crypto) in one batch request.
     */
    private int maxInstrumentsPerCategory = 50;

    /**
     * Worker threads for concurrent instrument resolution. Keep it at least 3 x maxInstrumentsPerCategory so one
     * batch never waits for a free thread.
     */
    private int resolverPoolSize = 150;

    /**
     * Outbound throttle for CryptoCompare (requests per second across all batches).
     */
    private int cryptocompareRequestsPerSecond = 20;

    /**
     * Max wait for an outbound CryptoCompare permit before the attempt counts as failed.
     */
    private long cryptocomparePermitTimeoutMs = 2000;

    /**
     * Time a live exchange rate stays cached. Fallback rates are never cached.
     */
    private long exchangeRateCacheTtlMinutes = 5;

    /**
     * Live IDR rates outside this range are logged as suspicious but still used.
     */
    private BigDecimal exchangeRateMin = new BigDecimal("5000");
    private BigDecimal exchangeRateMax = new BigDecimal("25000");

    /**
     * User-Agent values rotated per attempt.
     */
    private List<String> userAgents = new ArrayList<>(List.of(
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36",
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/125.0.0.0 Safari/537.36",
            "Mozilla/5.0 (X11; Linux x86_64; rv:126.0) Gecko/20100101 Firefox/126.0",
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 14_5) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.5 Safari/605.1.15"
    ));

    private GoldProperties gold = new GoldProperties();

    @Getter
    @Setter
    public static class GoldProperties {
        /** Markup applied on the scraped buy price to get the spot price (0.0025 = 0.25%). */
        private BigDecimal spotMarkup = new BigDecimal("0.0025");
        /** Proxy crypto symbol whose 24h change is reported for gold. */
        private String proxySymbol = "PAXG";
        /** Premium per gram over spot for physical bars, by brand (upper case). */
        private Map<String, BigDecimal> brandPremiums = new HashMap<>(Map.of("ANTAM", new BigDecimal("160000")));
    }
}
