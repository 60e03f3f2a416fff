package com.portsyncro.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Daily portfolio valuation record. Id is {@code userId:date}, so capturing the same date again replaces
 * the whole document (asset arrays included) instead of merging. totalInvestedIdr never includes cash.
 */
@Document(collection = "portfolio_snapshots")
@CompoundIndex(name = "user_date", def = "{'userId': 1, 'date': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class PortfolioSnapshot {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String userId;
    private LocalDate date;
    private BigDecimal totalValueIdr;
    private BigDecimal totalValueUsd;
    private BigDecimal totalInvestedIdr;
    private List<AssetClassBreakdown> breakdown = new ArrayList<>();
    private List<AssetSnapshot> assets = new ArrayList<>();
    private BigDecimal exchangeRate;
    private String exchangeRateSource;
    /** True when no live prices were available and stored valuations were used. */
    private boolean degraded;
    private int unresolvedCount;
    private Instant capturedAt;

    public static String snapshotId(String userId, LocalDate date) {
        return userId + ":" + date;
    }

    /** Profit/loss over invested capital; cash excluded from both sides. */
    public BigDecimal totalGainIdr() {
        BigDecimal cash = breakdown == null ? BigDecimal.ZERO : breakdown.stream()
                .filter(b -> b.assetClass() == AssetClass.CASH)
                .map(AssetClassBreakdown::valueIdr)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal value = totalValueIdr == null ? BigDecimal.ZERO : totalValueIdr;
        BigDecimal invested = totalInvestedIdr == null ? BigDecimal.ZERO : totalInvestedIdr;
        return value.subtract(cash).subtract(invested);
    }

    public List<AssetSnapshot> getAssets() {
        return assets == null ? List.of() : Collections.unmodifiableList(assets);
    }

    public PortfolioSnapshot setAssets(List<AssetSnapshot> assets) {
        this.assets = assets == null ? new ArrayList<>() : new ArrayList<>(assets);
        return this;
    }

    public List<AssetClassBreakdown> getBreakdown() {
        return breakdown == null ? List.of() : Collections.unmodifiableList(breakdown);
    }

    public PortfolioSnapshot setBreakdown(List<AssetClassBreakdown> breakdown) {
        this.breakdown = breakdown == null ? new ArrayList<>() : new ArrayList<>(breakdown);
        return this;
    }
}
