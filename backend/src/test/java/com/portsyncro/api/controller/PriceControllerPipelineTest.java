package com.portsyncro.api.controller;

import com.portsyncro.api.CallerIdentityResolver;
import com.portsyncro.api.dto.PriceRequest;
import com.portsyncro.api.dto.PriceResponse;
import com.portsyncro.pricing.BatchPriceService;
import com.portsyncro.pricing.InvalidPriceRequestException;
import com.portsyncro.pricing.config.PricingProperties;
import com.portsyncro.pricing.config.RateLimitProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

/**
 * The controller's Mono, without the web layer: which errors become a 500 body and which propagate.
 */
@ExtendWith(MockitoExtension.class)
class PriceControllerPipelineTest {

    @Mock
    BatchPriceService batchPriceService;

    private PriceController controller;

    @BeforeEach
    void setUp() {
        RateLimitProperties rateLimitProperties = new RateLimitProperties();
        controller = new PriceController(batchPriceService, new CallerIdentityResolver(rateLimitProperties),
                new PricingProperties(), rateLimitProperties);
    }

    @Test
    @DisplayName("an unexpected failure completes with a 500 and an empty price map")
    void unexpectedFailureMapsTo500() {
        when(batchPriceService.resolvePrices(any(), eq("user:u1"))).thenThrow(new IllegalStateException("boom"));

        StepVerifier.create(controller.prices(request(), "u1", MockServerHttpRequest.post("/api/prices").build()))
                .assertNext(response -> {
                    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
                    PriceResponse body = (PriceResponse) response.getBody();
                    assertThat(body.prices()).isEmpty();
                    assertThat(body.statusMessage()).isEqualTo(PriceController.STATUS_FAILED);
                    assertThat(body.timestamp()).isNotNull();
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("an invalid request error propagates for the 400 handler")
    void invalidRequestPropagates() {
        when(batchPriceService.resolvePrices(any(), any()))
                .thenThrow(new InvalidPriceRequestException("Too many stocks"));

        StepVerifier.create(controller.prices(request(), "u1", MockServerHttpRequest.post("/api/prices").build()))
                .expectError(InvalidPriceRequestException.class)
                .verify();
    }

    private static PriceRequest request() {
        return new PriceRequest(List.of("BBCA.JK"), null, null, null);
    }
}
