package com.portsyncro.api.dto;

import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * POST /api/prices body. gold=true adds spot gold and every configured bar brand.
 * The raw list bound only guards against abusive payloads; the per-category cap applies after deduplication.
 */
public record PriceRequest(
        @Size(max = 200, message = "too many entries") List<String> stocks,
        @Size(max = 200, message = "too many entries") List<String> crypto,
        Boolean gold,
        @Size(max = 128) String userId
) {
}
