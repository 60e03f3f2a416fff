package com.portsyncro.api.controller;

import com.portsyncro.api.dto.ExchangeRateResponse;
import com.portsyncro.pricing.ExchangeRateService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * GET /api/exchange-rate. Always answers; source "Fallback (Offline)" marks the constant rate.
 */
@RestController
@RequestMapping("/api/exchange-rate")
@RequiredArgsConstructor
public class ExchangeRateController {

    private final ExchangeRateService exchangeRateService;

    @GetMapping
    public Mono<ExchangeRateResponse> current() {
        return Mono.fromCallable(() -> ExchangeRateResponse.from(exchangeRateService.currentRate()))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
