package com.portsyncro.domain;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Point-in-time entry for one position within a portfolio snapshot. Monetary fields follow {@link Valuation} rounding.
 */
public class AssetSnapshot {

    private String instrumentId;
    private AssetClass assetClass;
    private BigDecimal quantity;
    private BigDecimal avgCost;
    private BigDecimal priceUsed;
    private BigDecimal valueIdr;
    private BigDecimal valueUsd;
    private BigDecimal costBasisIdr;
    private BigDecimal gainIdr;
    private BigDecimal gainUsd;
    private BigDecimal gainPercent;
    private ValuationError error;

    public static AssetSnapshot of(Position position, Valuation valuation) {
        AssetSnapshot s = new AssetSnapshot();
        s.setInstrumentId(position.getInstrumentId());
        s.setAssetClass(position.getAssetClass());
        s.setQuantity(position.getQuantity());
        s.setAvgCost(position.getAvgCost());
        s.setPriceUsed(valuation.priceUsed());
        s.setValueIdr(valuation.valueIdr());
        s.setValueUsd(valuation.valueUsd());
        s.setCostBasisIdr(valuation.costBasisIdr());
        s.setGainIdr(valuation.gainIdr());
        s.setGainUsd(valuation.gainUsd());
        s.setGainPercent(valuation.gainPercent());
        s.setError(valuation.error());
        return s;
    }

    public String getInstrumentId() {
        return instrumentId;
    }

    public void setInstrumentId(String instrumentId) {
        this.instrumentId = instrumentId;
    }

    public AssetClass getAssetClass() {
        return assetClass;
    }

    public void setAssetClass(AssetClass assetClass) {
        this.assetClass = assetClass;
    }

    public BigDecimal getQuantity() {
        return quantity;
    }

    public void setQuantity(BigDecimal quantity) {
        this.quantity = quantity;
    }

    public BigDecimal getAvgCost() {
        return avgCost;
    }

    public void setAvgCost(BigDecimal avgCost) {
        this.avgCost = avgCost;
    }

    public BigDecimal getPriceUsed() {
        return priceUsed;
    }

    public void setPriceUsed(BigDecimal priceUsed) {
        this.priceUsed = priceUsed;
    }

    public BigDecimal getValueIdr() {
        return valueIdr;
    }

    public void setValueIdr(BigDecimal valueIdr) {
        this.valueIdr = valueIdr;
    }

    public BigDecimal getValueUsd() {
        return valueUsd;
    }

    public void setValueUsd(BigDecimal valueUsd) {
        this.valueUsd = valueUsd;
    }

    public BigDecimal getCostBasisIdr() {
        return costBasisIdr;
    }

    public void setCostBasisIdr(BigDecimal costBasisIdr) {
        this.costBasisIdr = costBasisIdr;
    }

    public BigDecimal getGainIdr() {
        return gainIdr;
    }

    public void setGainIdr(BigDecimal gainIdr) {
        this.gainIdr = gainIdr;
    }

    public BigDecimal getGainUsd() {
        return gainUsd;
    }

    public void setGainUsd(BigDecimal gainUsd) {
        this.gainUsd = gainUsd;
    }

    public BigDecimal getGainPercent() {
        return gainPercent;
    }

    public void setGainPercent(BigDecimal gainPercent) {
        this.gainPercent = gainPercent;
    }

    public ValuationError getError() {
        return error;
    }

    public void setError(ValuationError error) {
        this.error = error;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AssetSnapshot that = (AssetSnapshot) o;
        return Objects.equals(instrumentId, that.instrumentId)
                && assetClass == that.assetClass
                && Objects.equals(quantity, that.quantity)
                && Objects.equals(avgCost, that.avgCost);
    }

    @Override
    public int hashCode() {
        return Objects.hash(instrumentId, assetClass, quantity, avgCost);
    }
}
