package com.portsyncro.valuation;

import com.portsyncro.domain.AssetClass;
import com.portsyncro.domain.AssetClassBreakdown;
import com.portsyncro.domain.AssetSnapshot;
import com.portsyncro.domain.ExchangeRate;
import com.portsyncro.domain.Portfolio;
import com.portsyncro.domain.PortfolioSnapshot;
import com.portsyncro.domain.Position;
import com.portsyncro.domain.ResolvedPrice;
import com.portsyncro.domain.Valuation;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Rolls a portfolio and a price map into one daily snapshot. Totals are sums of the rounded per-position values,
 * so the same inputs always give the same figures. Cash adds to value only, never to invested capital or gain.
 * <p>
 * With an empty price map the snapshot is built in degraded mode from the last valuation stored on each holding;
 * cash and manually priced holdings are still valued live. A portfolio with nothing to fetch is never degraded.
 */
@Component
@RequiredArgsConstructor
public class SnapshotAggregator {

    private final ValuationEngine valuationEngine;
    private final Clock clock;

    public PortfolioSnapshot aggregate(Portfolio portfolio, Map<String, ResolvedPrice> prices, ExchangeRate exchangeRate) {
        return aggregate(portfolio, prices, exchangeRate, LocalDate.now(clock));
    }

    public PortfolioSnapshot aggregate(Portfolio portfolio, Map<String, ResolvedPrice> prices,
                                       ExchangeRate exchangeRate, LocalDate date) {
        boolean degraded = (prices == null || prices.isEmpty())
                && portfolio.allPositions().stream().anyMatch(SnapshotAggregator::usesStoredValuation);
        Map<String, ResolvedPrice> byKey = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (prices != null) {
            byKey.putAll(prices);
        }

        List<AssetSnapshot> assets = new ArrayList<>();
        Map<AssetClass, Totals> totals = new EnumMap<>(AssetClass.class);
        int unresolved = 0;
        for (Position position : portfolio.allPositions()) {
            Valuation valuation = degraded && usesStoredValuation(position)
                    ? storedValuation(position, exchangeRate)
                    : valuationEngine.value(position, byKey.get(position.priceKey()), exchangeRate);
            if (valuation.isPriceUnavailable()) {
                unresolved++;
            }
            assets.add(AssetSnapshot.of(position, valuation));
            totals.computeIfAbsent(position.getAssetClass(), c -> new Totals()).add(valuation);
        }

        BigDecimal totalValueIdr = BigDecimal.ZERO;
        BigDecimal totalValueUsd = BigDecimal.ZERO;
        BigDecimal totalInvestedIdr = BigDecimal.ZERO;
        List<AssetClassBreakdown> breakdown = new ArrayList<>();
        for (AssetClass assetClass : AssetClass.values()) {
            Totals t = totals.getOrDefault(assetClass, new Totals());
            boolean cash = assetClass == AssetClass.CASH;
            BigDecimal invested = cash ? BigDecimal.ZERO : t.costBasisIdr;
            BigDecimal gain = cash ? BigDecimal.ZERO : t.gainIdr;
            breakdown.add(new AssetClassBreakdown(assetClass, t.valueIdr, t.valueUsd, invested, gain, t.positions));
            totalValueIdr = totalValueIdr.add(t.valueIdr);
            totalValueUsd = totalValueUsd.add(t.valueUsd);
            totalInvestedIdr = totalInvestedIdr.add(invested);
        }

        PortfolioSnapshot snapshot = new PortfolioSnapshot();
        snapshot.setId(PortfolioSnapshot.snapshotId(portfolio.getUserId(), date));
        snapshot.setUserId(portfolio.getUserId());
        snapshot.setDate(date);
        snapshot.setTotalValueIdr(totalValueIdr);
        snapshot.setTotalValueUsd(totalValueUsd.setScale(2, RoundingMode.HALF_UP));
        snapshot.setTotalInvestedIdr(totalInvestedIdr);
        snapshot.setBreakdown(breakdown);
        snapshot.setAssets(assets);
        if (exchangeRate != null) {
            snapshot.setExchangeRate(exchangeRate.rate());
            snapshot.setExchangeRateSource(exchangeRate.source());
        }
        snapshot.setDegraded(degraded);
        snapshot.setUnresolvedCount(unresolved);
        snapshot.setCapturedAt(clock.instant());
        return snapshot;
    }

    private static boolean usesStoredValuation(Position position) {
        return position.getAssetClass() != AssetClass.CASH && !position.hasManualPrice();
    }

    /**
     * Last stored valuation of a holding; missing fields count as zero. The USD gain is bridged from the IDR gain
     * when a rate is available.
     */
    static Valuation storedValuation(Position position, ExchangeRate exchangeRate) {
        BigDecimal valueIdr = orZero(position.getLastValueIdr());
        BigDecimal valueUsd = orZero(position.getLastValueUsd());
        BigDecimal costIdr = orZero(position.getLastCostBasisIdr());
        BigDecimal gainIdr = valueIdr.subtract(costIdr);
        BigDecimal gainUsd = exchangeRate != null && exchangeRate.isUsable()
                ? gainIdr.divide(exchangeRate.rate(), 2, RoundingMode.HALF_UP)
                : BigDecimal.ZERO;
        return new Valuation(ValuationEngine.idr(valueIdr), ValuationEngine.usd(valueUsd), ValuationEngine.idr(costIdr),
                ValuationEngine.idr(gainIdr), gainUsd, ValuationEngine.gainPercent(gainIdr, costIdr),
                orZero(position.getLastPrice()), null);
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }

    private static final class Totals {
        private BigDecimal valueIdr = BigDecimal.ZERO;
        private BigDecimal valueUsd = BigDecimal.ZERO;
        private BigDecimal costBasisIdr = BigDecimal.ZERO;
        private BigDecimal gainIdr = BigDecimal.ZERO;
        private int positions;

        void add(Valuation v) {
            valueIdr = valueIdr.add(v.valueIdr());
            valueUsd = valueUsd.add(v.valueUsd());
            costBasisIdr = costBasisIdr.add(v.costBasisIdr());
            gainIdr = gainIdr.add(v.gainIdr());
            positions++;
        }
    }
}
