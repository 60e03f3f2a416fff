package com.portsyncro.pricing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.portsyncro.config.CaffeineConfig;
import com.portsyncro.domain.ExchangeRate;
import com.portsyncro.pricing.config.PricingProperties;
import com.portsyncro.pricing.fetch.ClientHeaderPool;
import com.portsyncro.pricing.fetch.FetchException;
import com.portsyncro.pricing.fetch.RawResponse;
import com.portsyncro.pricing.fetch.SourceFetcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Current USD/IDR rate. Any upstream failure yields {@link ExchangeRate#fallback}, which callers treat as valid input.
 * Live rates are cached in {@link CaffeineConfig#EXCHANGE_RATE_CACHE}; fallbacks are not, so the next call retries.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExchangeRateService {

    static final String SOURCE = "exchangerate-api.com";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final PricingProperties pricingProperties;
    private final SourceFetcher sourceFetcher;
    private final ClientHeaderPool clientHeaderPool;
    private final Clock clock;

    @Cacheable(cacheNames = CaffeineConfig.EXCHANGE_RATE_CACHE, key = "'USD_IDR'",
            unless = "#result == null || #result.isFallback()")
    public ExchangeRate currentRate() {
        try {
            RawResponse response = sourceFetcher.fetch(pricingProperties.getExchangeRateUrl(), clientHeaderPool.forJson(),
                    Duration.ofMillis(pricingProperties.getFetchTimeoutMs()));
            Optional<BigDecimal> rate = parseIdrRate(response.body());
            if (rate.isEmpty()) {
                log.warn("Exchange rate payload had no IDR rate, using fallback {}", ExchangeRate.FALLBACK_RATE);
                return ExchangeRate.fallback(clock.instant());
            }
            if (rate.get().compareTo(pricingProperties.getExchangeRateMin()) < 0
                    || rate.get().compareTo(pricingProperties.getExchangeRateMax()) > 0) {
                log.warn("USD/IDR rate {} outside expected range {}-{}", rate.get(),
                        pricingProperties.getExchangeRateMin(), pricingProperties.getExchangeRateMax());
            }
            return new ExchangeRate(rate.get(), SOURCE, clock.instant());
        } catch (FetchException e) {
            log.warn("Exchange rate fetch failed ({}), using fallback {}", e.getReason(), ExchangeRate.FALLBACK_RATE);
            return ExchangeRate.fallback(clock.instant());
        }
    }

    /**
     * Reads IDR from {@code conversion_rates.IDR}, {@code rates.IDR} or a root {@code IDR}, in that order.
     */
    static Optional<BigDecimal> parseIdrRate(String json) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode root = MAPPER.readTree(json);
            for (JsonNode candidate : new JsonNode[]{
                    root.path("conversion_rates").path("IDR"), root.path("rates").path("IDR"), root.path("IDR")}) {
                if (candidate.isNumber() && candidate.decimalValue().signum() > 0) {
                    return Optional.of(candidate.decimalValue());
                }
            }
            return Optional.empty();
        } catch (Exception e) {
            log.debug("Exchange rate body is not JSON: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
