package com.portsyncro.pricing.strategy;

import com.portsyncro.domain.InstrumentId;
import com.portsyncro.domain.PriceSource;
import com.portsyncro.domain.ResolvedPrice;

import java.util.Optional;

/**
 * One upstream price source. Each implementation normalizes its own response shape into {@link ResolvedPrice}.
 * Returns empty when the upstream answered without a usable price; may throw
 * {@link com.portsyncro.pricing.fetch.FetchException} when the upstream could not be reached.
 */
public interface PriceStrategy {

    PriceSource source();

    Optional<ResolvedPrice> fetch(InstrumentId instrumentId);
}
