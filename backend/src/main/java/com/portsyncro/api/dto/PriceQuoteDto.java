package com.portsyncro.api.dto;

import com.portsyncro.domain.ResolvedPrice;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One price in the response: change is the signed percent over changeTime ("24h" or "1d").
 */
public record PriceQuoteDto(
        BigDecimal price,
        String currency,
        BigDecimal change,
        String changeTime,
        Instant lastUpdate,
        String source
) {

    public static PriceQuoteDto from(ResolvedPrice p) {
        return new PriceQuoteDto(p.price(), p.currency().name(), p.changePercent(), p.changeWindow(),
                p.resolvedAt(), p.source().name());
    }
}
