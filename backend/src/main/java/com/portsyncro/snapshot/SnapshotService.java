package com.portsyncro.snapshot;

import com.portsyncro.config.CaffeineConfig;
import com.portsyncro.domain.AssetClass;
import com.portsyncro.domain.AssetSnapshot;
import com.portsyncro.domain.ExchangeRate;
import com.portsyncro.domain.Portfolio;
import com.portsyncro.domain.PortfolioRepository;
import com.portsyncro.domain.PortfolioSnapshot;
import com.portsyncro.domain.PortfolioSnapshotRepository;
import com.portsyncro.domain.Position;
import com.portsyncro.domain.ResolvedPrice;
import com.portsyncro.pricing.BatchPriceResult;
import com.portsyncro.pricing.BatchPriceService;
import com.portsyncro.pricing.ExchangeRateService;
import com.portsyncro.pricing.PriceBatchRequest;
import com.portsyncro.valuation.SnapshotAggregator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Captures today's snapshot of a stored portfolio: resolves prices and the rate, aggregates, and saves under the
 * {@code userId:date} id so a repeated capture replaces the day's record. After a live capture the fresh valuations
 * are written back to the holdings, where a later degraded capture can find them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SnapshotService {

    private final PortfolioRepository portfolioRepository;
    private final PortfolioSnapshotRepository snapshotRepository;
    private final BatchPriceService batchPriceService;
    private final ExchangeRateService exchangeRateService;
    private final SnapshotAggregator snapshotAggregator;

    /**
     * @throws PortfolioNotFoundException when the user has no stored portfolio
     */
    @CacheEvict(cacheNames = CaffeineConfig.SNAPSHOT_HISTORY_CACHE, key = "#userId")
    public PortfolioSnapshot capture(String userId) {
        Portfolio portfolio = portfolioRepository.findById(userId)
                .orElseThrow(() -> new PortfolioNotFoundException(userId));
        Map<String, ResolvedPrice> prices = fetchPrices(portfolio, userId);
        ExchangeRate rate = exchangeRateService.currentRate();

        PortfolioSnapshot snapshot = snapshotAggregator.aggregate(portfolio, prices, rate);
        PortfolioSnapshot saved = snapshotRepository.save(snapshot);
        if (!snapshot.isDegraded()) {
            rememberValuations(portfolio, snapshot.getAssets());
            portfolioRepository.save(portfolio);
        }
        log.info("Snapshot {} captured: value {} IDR, invested {} IDR, {} unresolved{}",
                saved.getId(), saved.getTotalValueIdr(), saved.getTotalInvestedIdr(), saved.getUnresolvedCount(),
                saved.isDegraded() ? " (degraded)" : "");
        return saved;
    }

    @Cacheable(cacheNames = CaffeineConfig.SNAPSHOT_HISTORY_CACHE, key = "#userId")
    public List<PortfolioSnapshot> history(String userId) {
        return snapshotRepository.findByUserIdOrderByDateDesc(userId);
    }

    private Map<String, ResolvedPrice> fetchPrices(Portfolio portfolio, String userId) {
        PriceBatchRequest request = new PriceBatchRequest(
                fetchedKeys(portfolio.getStocks()),
                fetchedKeys(portfolio.getCrypto()),
                fetchedKeys(portfolio.getGold()));
        if (request.isEmpty()) {
            return Map.of();
        }
        BatchPriceResult result = batchPriceService.resolvePrices(request, "user:" + userId);
        if (result.rejected()) {
            log.warn("Price resolution refused for {}, capturing from stored valuations", userId);
            return Map.of();
        }
        return result.prices();
    }

    /** Manually priced holdings need no fetch. */
    private static List<String> fetchedKeys(List<Position> positions) {
        return positions.stream().filter(p -> !p.hasManualPrice()).map(Position::priceKey).toList();
    }

    /** Positions and assets are in the same order ({@link Portfolio#allPositions()}). */
    private static void rememberValuations(Portfolio portfolio, List<AssetSnapshot> assets) {
        List<Position> positions = portfolio.allPositions();
        for (int i = 0; i < positions.size() && i < assets.size(); i++) {
            Position position = positions.get(i);
            AssetSnapshot asset = assets.get(i);
            if (position.getAssetClass() == AssetClass.CASH || asset.getError() != null) {
                continue;
            }
            position.setLastPrice(asset.getPriceUsed());
            position.setLastValueIdr(asset.getValueIdr());
            position.setLastValueUsd(asset.getValueUsd());
            position.setLastCostBasisIdr(asset.getCostBasisIdr());
        }
    }
}
