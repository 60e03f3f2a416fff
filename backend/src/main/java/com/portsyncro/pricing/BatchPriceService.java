package com.portsyncro.pricing;

import com.portsyncro.common.SlidingWindowRateLimiter;
import com.portsyncro.config.AsyncConfig;
import com.portsyncro.domain.InstrumentId;
import com.portsyncro.domain.InstrumentKind;
import com.portsyncro.domain.ResolvedPrice;
import com.portsyncro.pricing.config.PricingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Resolves a batch of instruments concurrently on the price executor. The caller's identity is admitted by the
 * rate limiter before any validation or network work. Instruments are deduplicated case-insensitively (first
 * spelling wins) and each category is capped. A failed instrument is left out of the result; the batch returns once
 * every resolution has settled.
 */
@Service
@Slf4j
public class BatchPriceService {

    private final InstrumentPriceResolver instrumentPriceResolver;
    private final SlidingWindowRateLimiter rateLimiter;
    private final PricingProperties pricingProperties;
    private final Executor priceExecutor;
    private final Clock clock;

    public BatchPriceService(InstrumentPriceResolver instrumentPriceResolver,
                             SlidingWindowRateLimiter rateLimiter,
                             PricingProperties pricingProperties,
                             @Qualifier(AsyncConfig.PRICE_EXECUTOR) Executor priceExecutor,
                             Clock clock) {
        this.instrumentPriceResolver = instrumentPriceResolver;
        this.rateLimiter = rateLimiter;
        this.pricingProperties = pricingProperties;
        this.priceExecutor = priceExecutor;
        this.clock = clock;
    }

    /**
     * @throws InvalidPriceRequestException on an invalid symbol or a category over the cap (only after admission)
     */
    public BatchPriceResult resolvePrices(PriceBatchRequest request, String callerIdentity) {
        if (!rateLimiter.admit(callerIdentity, clock.instant())) {
            return BatchPriceResult.rejected(callerIdentity);
        }
        List<Target> targets = new ArrayList<>();
        targets.addAll(targets("stocks", request.stocks(), null));
        targets.addAll(targets("crypto", request.crypto(), InstrumentKind.CRYPTO));
        targets.addAll(targets("gold", request.gold(), InstrumentKind.GOLD));
        if (targets.isEmpty()) {
            return BatchPriceResult.of(Map.of(), callerIdentity);
        }

        List<CompletableFuture<PriceResolution>> futures = new ArrayList<>(targets.size());
        for (Target target : targets) {
            futures.add(CompletableFuture
                    .supplyAsync(() -> instrumentPriceResolver.resolve(target.id(), target.kind()), priceExecutor)
                    .exceptionally(e -> {
                        log.warn("Resolution of {} failed", target.id(), e);
                        return PriceResolution.unavailable();
                    }));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        Map<String, ResolvedPrice> prices = new LinkedHashMap<>();
        for (int i = 0; i < targets.size(); i++) {
            Target target = targets.get(i);
            futures.get(i).join().getPrice().ifPresent(p -> prices.put(target.id().value(), p));
        }
        log.debug("Resolved {}/{} instruments for {}", prices.size(), targets.size(), callerIdentity);
        return BatchPriceResult.of(prices, callerIdentity);
    }

    /**
     * Validates and deduplicates one category. A null kind means equities, whose market comes from the suffix.
     */
    private List<Target> targets(String category, List<String> raw, InstrumentKind kind) {
        Map<String, Target> unique = new LinkedHashMap<>();
        for (String value : raw) {
            if (!InstrumentId.isValid(value)) {
                throw new InvalidPriceRequestException("Invalid symbol in " + category + ": " + value);
            }
            InstrumentId id = InstrumentId.of(value);
            if (kind == InstrumentKind.GOLD && !id.isGold()) {
                throw new InvalidPriceRequestException("Invalid gold id: " + value);
            }
            unique.putIfAbsent(id.key(), new Target(id, kind != null ? kind : id.equityKind()));
        }
        int cap = pricingProperties.getMaxInstrumentsPerCategory();
        if (unique.size() > cap) {
            throw new InvalidPriceRequestException(
                    "Too many " + category + ": " + unique.size() + " unique instruments, max " + cap);
        }
        return new ArrayList<>(unique.values());
    }

    private record Target(InstrumentId id, InstrumentKind kind) {}
}
