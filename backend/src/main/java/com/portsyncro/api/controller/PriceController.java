package com.portsyncro.api.controller;

import com.portsyncro.api.CallerIdentityResolver;
import com.portsyncro.api.dto.PriceQuoteDto;
import com.portsyncro.api.dto.PriceRequest;
import com.portsyncro.api.dto.PriceResponse;
import com.portsyncro.api.dto.RateLimitErrorBody;
import com.portsyncro.pricing.BatchPriceResult;
import com.portsyncro.pricing.BatchPriceService;
import com.portsyncro.pricing.InvalidPriceRequestException;
import com.portsyncro.pricing.PriceBatchRequest;
import com.portsyncro.pricing.config.PricingProperties;
import com.portsyncro.pricing.config.RateLimitProperties;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * POST /api/prices. Batch price resolution for stocks, crypto and gold. The blocking batch runs off the event loop.
 * Upstream failures only shrink the price map; an unexpected error answers 500 with an empty map.
 */
@RestController
@RequestMapping("/api/prices")
@RequiredArgsConstructor
@Slf4j
public class PriceController {

    static final String USER_ID_HEADER = "X-User-Id";
    static final String STATUS_OK = "Prices updated";
    static final String STATUS_FAILED = "Failed to fetch prices";

    private final BatchPriceService batchPriceService;
    private final CallerIdentityResolver callerIdentityResolver;
    private final PricingProperties pricingProperties;
    private final RateLimitProperties rateLimitProperties;

    @PostMapping
    public Mono<ResponseEntity<?>> prices(@RequestBody(required = false) @Valid PriceRequest request,
                                          @RequestHeader(value = USER_ID_HEADER, required = false) String userIdHeader,
                                          ServerHttpRequest httpRequest) {
        PriceRequest body = request != null ? request : new PriceRequest(null, null, null, null);
        String identity = callerIdentityResolver.resolve(userIdHeader, body.userId(), httpRequest);
        return Mono.<ResponseEntity<?>>fromCallable(() -> resolve(body, identity))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(e -> !(e instanceof InvalidPriceRequestException), e -> {
                    log.error("Price request failed for {}", identity, e);
                    return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                            .body(new PriceResponse(Map.of(), Instant.now(), STATUS_FAILED)));
                });
    }

    private ResponseEntity<?> resolve(PriceRequest body, String identity) {
        BatchPriceResult result = batchPriceService.resolvePrices(toBatchRequest(body), identity);
        if (result.rejected()) {
            long retryAfter = rateLimitProperties.getWindowSeconds();
            return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                    .header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfter))
                    .body(RateLimitErrorBody.of(retryAfter, identity));
        }
        Map<String, PriceQuoteDto> prices = new LinkedHashMap<>();
        result.prices().forEach((id, price) -> prices.put(id, PriceQuoteDto.from(price)));
        return ResponseEntity.ok(new PriceResponse(prices, Instant.now(), STATUS_OK));
    }

    private PriceBatchRequest toBatchRequest(PriceRequest body) {
        List<String> gold = new ArrayList<>();
        if (Boolean.TRUE.equals(body.gold())) {
            gold.add("GOLD");
            pricingProperties.getGold().getBrandPremiums().keySet().stream()
                    .sorted()
                    .forEach(brand -> gold.add("GOLD:" + brand));
        }
        return new PriceBatchRequest(body.stocks(), body.crypto(), gold);
    }
}
