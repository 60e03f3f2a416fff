package com.portsyncro.domain;

import java.math.BigDecimal;

/**
 * Per asset class totals inside a snapshot. For CASH investedIdr and gainIdr are always zero.
 */
public record AssetClassBreakdown(
        AssetClass assetClass,
        BigDecimal valueIdr,
        BigDecimal valueUsd,
        BigDecimal investedIdr,
        BigDecimal gainIdr,
        int positions
) {
}
