package com.portsyncro.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * One holding inside a {@link Portfolio}. Quantity unit depends on the asset class: lots (IDX stocks),
 * shares (US stocks), coin units (crypto), grams (gold) or currency amount (cash).
 * avgCost is the native-currency price per unit at acquisition (per share for IDX stocks).
 * The last* fields hold the most recent stored valuation and are only read in degraded snapshot mode.
 */
@NoArgsConstructor
@Getter
@Setter
public class Position {

    private String instrumentId;
    private AssetClass assetClass;
    /** Stocks only. May be missing on older holdings, see {@link #effectiveMarket()}. */
    private Market market;
    private BigDecimal quantity;
    private BigDecimal avgCost;
    /** Cash: denomination of the amount. Stocks: trading currency, used when market is missing. */
    private PriceCurrency currency;
    /** Stock, crypto and gold: user-entered price in the native currency that replaces the fetched one. */
    private BigDecimal manualPrice;

    private BigDecimal lastPrice;
    private BigDecimal lastValueIdr;
    private BigDecimal lastValueUsd;
    private BigDecimal lastCostBasisIdr;

    public static Position stock(String ticker, Market market, BigDecimal quantity, BigDecimal avgCost) {
        Position p = new Position();
        p.setInstrumentId(ticker);
        p.setAssetClass(AssetClass.STOCK);
        p.setMarket(market);
        p.setQuantity(quantity);
        p.setAvgCost(avgCost);
        return p;
    }

    public static Position crypto(String symbol, BigDecimal amount, BigDecimal avgCost) {
        Position p = new Position();
        p.setInstrumentId(symbol);
        p.setAssetClass(AssetClass.CRYPTO);
        p.setQuantity(amount);
        p.setAvgCost(avgCost);
        return p;
    }

    public static Position gold(String instrumentId, BigDecimal grams, BigDecimal avgCost) {
        Position p = new Position();
        p.setInstrumentId(instrumentId);
        p.setAssetClass(AssetClass.GOLD);
        p.setQuantity(grams);
        p.setAvgCost(avgCost);
        return p;
    }

    public static Position cash(String label, PriceCurrency currency, BigDecimal amount) {
        Position p = new Position();
        p.setInstrumentId(label);
        p.setAssetClass(AssetClass.CASH);
        p.setCurrency(currency);
        p.setQuantity(amount);
        p.setAvgCost(BigDecimal.ONE);
        return p;
    }

    /**
     * Key of this position in a price map: {@code BBCA.JK} for IDX stocks, upper-cased id otherwise.
     */
    public String priceKey() {
        if (instrumentId == null) {
            return "";
        }
        if (assetClass == AssetClass.STOCK && effectiveMarket() == Market.DOMESTIC) {
            String ticker = instrumentId.strip().toUpperCase(Locale.ROOT);
            int sep = ticker.indexOf('.');
            if (sep < 0) {
                sep = ticker.indexOf(':');
            }
            return (sep < 0 ? ticker : ticker.substring(0, sep)) + ".JK";
        }
        return instrumentId.strip().toUpperCase(Locale.ROOT);
    }

    /**
     * Listing market of a stock. A holding without one is foreign when traded in USD and IDX otherwise.
     */
    public Market effectiveMarket() {
        if (market != null) {
            return market;
        }
        return currency == PriceCurrency.USD ? Market.FOREIGN : Market.DOMESTIC;
    }

    /** True for a priced asset (not cash) carrying a positive manual price. */
    public boolean hasManualPrice() {
        return assetClass != null && assetClass != AssetClass.CASH && manualPrice != null && manualPrice.signum() > 0;
    }
}
