package com.portsyncro.pricing;

import com.portsyncro.domain.InstrumentId;
import com.portsyncro.domain.InstrumentKind;
import com.portsyncro.domain.ResolvedPrice;
import com.portsyncro.pricing.fetch.FetchException;
import com.portsyncro.pricing.strategy.CryptoCompareFullStrategy;
import com.portsyncro.pricing.strategy.CryptoCompareSpotStrategy;
import com.portsyncro.pricing.strategy.GoogleFinanceQuoteStrategy;
import com.portsyncro.pricing.strategy.IndoGoldStrategy;
import com.portsyncro.pricing.strategy.PaxgGoldStrategy;
import com.portsyncro.pricing.strategy.PriceStrategy;
import com.portsyncro.pricing.strategy.YahooChartStrategy;
import com.portsyncro.pricing.strategy.YahooQuoteStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Chains per instrument kind, tried in order until one strategy yields a price:
 * <ul>
 *   <li>IDX equity: Google Finance scrape → Yahoo quote → Yahoo chart</li>
 *   <li>foreign equity: Yahoo quote → Yahoo chart</li>
 *   <li>crypto: CryptoCompare full → CryptoCompare spot</li>
 *   <li>gold: IndoGold → PAXG proxy</li>
 * </ul>
 * A strategy that throws is treated like one that found nothing.
 */
@Component
@Slf4j
public class InstrumentPriceResolver {

    private final Map<InstrumentKind, List<PriceStrategy>> chains;

    @Autowired
    public InstrumentPriceResolver(GoogleFinanceQuoteStrategy googleFinance,
                                   YahooQuoteStrategy yahooQuote,
                                   YahooChartStrategy yahooChart,
                                   CryptoCompareFullStrategy cryptoCompareFull,
                                   CryptoCompareSpotStrategy cryptoCompareSpot,
                                   IndoGoldStrategy indoGold,
                                   PaxgGoldStrategy paxgGold) {
        this(Map.of(
                InstrumentKind.DOMESTIC_EQUITY, List.of(googleFinance, yahooQuote, yahooChart),
                InstrumentKind.FOREIGN_EQUITY, List.of(yahooQuote, yahooChart),
                InstrumentKind.CRYPTO, List.of(cryptoCompareFull, cryptoCompareSpot),
                InstrumentKind.GOLD, List.of(indoGold, paxgGold)));
    }

    public InstrumentPriceResolver(Map<InstrumentKind, List<PriceStrategy>> chains) {
        this.chains = new EnumMap<>(InstrumentKind.class);
        chains.forEach((kind, chain) -> this.chains.put(kind, List.copyOf(chain)));
    }

    public PriceResolution resolve(InstrumentId instrumentId, InstrumentKind kind) {
        for (PriceStrategy strategy : chains.getOrDefault(kind, List.of())) {
            Optional<ResolvedPrice> price = attempt(strategy, instrumentId);
            if (price.isPresent()) {
                return PriceResolution.resolved(price.get());
            }
        }
        log.debug("No price for {} ({})", instrumentId, kind);
        return PriceResolution.unavailable();
    }

    public List<PriceStrategy> chainFor(InstrumentKind kind) {
        return chains.getOrDefault(kind, List.of());
    }

    private static Optional<ResolvedPrice> attempt(PriceStrategy strategy, InstrumentId instrumentId) {
        try {
            Optional<ResolvedPrice> price = strategy.fetch(instrumentId);
            if (price.isEmpty()) {
                log.debug("{} had no usable price for {}", strategy.source(), instrumentId);
            }
            return price;
        } catch (FetchException e) {
            log.warn("{} failed for {}: {} ({})", strategy.source(), instrumentId, e.getReason(), e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            log.warn("{} error for {}", strategy.source(), instrumentId, e);
            return Optional.empty();
        }
    }
}
