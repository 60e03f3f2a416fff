package com.portsyncro.api.dto;

import java.time.Instant;
import java.util.Map;

public record PriceResponse(Map<String, PriceQuoteDto> prices, Instant timestamp, String statusMessage) {
}
