package com.portsyncro.valuation;

import com.portsyncro.domain.AssetClass;
import com.portsyncro.domain.ExchangeRate;
import com.portsyncro.domain.Market;
import com.portsyncro.domain.Position;
import com.portsyncro.domain.PriceCurrency;
import com.portsyncro.domain.ResolvedPrice;
import com.portsyncro.domain.Valuation;
import com.portsyncro.domain.ValuationError;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Values one position from a resolved price and the USD/IDR rate. Stateless; never mutates the position.
 * <p>
 * Units: IDX stock quantity is in lots of {@value #SHARES_PER_LOT} shares; foreign stocks and crypto are used as-is;
 * gold is in grams; cash quantity is its face amount. IDX stocks and gold are native IDR, crypto and foreign stocks
 * native USD, cash in its own currency. Gain is computed in the native currency and then bridged with the rate.
 * IDR amounts are rounded to whole rupiah and USD amounts to cents, HALF_UP.
 */
@Component
public class ValuationEngine {

    public static final int SHARES_PER_LOT = 100;

    private static final int IDR_SCALE = 0;
    private static final int USD_SCALE = 2;
    private static final int PERCENT_SCALE = 2;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public Valuation value(Position position, ResolvedPrice resolvedPrice, ExchangeRate exchangeRate) {
        if (position.getAssetClass() == AssetClass.CASH) {
            return valueCash(position, exchangeRate);
        }
        BigDecimal price = effectivePrice(position, resolvedPrice);
        if (price == null) {
            return Valuation.unavailable();
        }
        BigDecimal units = units(position);
        BigDecimal avgCost = position.getAvgCost() != null ? position.getAvgCost() : BigDecimal.ZERO;
        BigDecimal value = units.multiply(price);
        BigDecimal cost = units.multiply(avgCost);
        BigDecimal gain = value.subtract(cost);
        BigDecimal gainPercent = gainPercent(gain, cost);
        BigDecimal rate = usableRate(exchangeRate);

        if (nativeCurrency(position) == PriceCurrency.IDR) {
            return new Valuation(
                    idr(value),
                    rate == null ? BigDecimal.ZERO.setScale(USD_SCALE) : toUsd(value, rate),
                    idr(cost),
                    idr(gain),
                    rate == null ? BigDecimal.ZERO.setScale(USD_SCALE) : toUsd(gain, rate),
                    gainPercent,
                    price,
                    rate == null ? ValuationError.EXCHANGE_RATE_UNAVAILABLE : null);
        }
        return new Valuation(
                rate == null ? BigDecimal.ZERO : idr(value.multiply(rate)),
                usd(value),
                rate == null ? BigDecimal.ZERO : idr(cost.multiply(rate)),
                rate == null ? BigDecimal.ZERO : idr(gain.multiply(rate)),
                usd(gain),
                gainPercent,
                price,
                rate == null ? ValuationError.EXCHANGE_RATE_UNAVAILABLE : null);
    }

    /** Cash has face value only: no cost basis and no gain. */
    private Valuation valueCash(Position position, ExchangeRate exchangeRate) {
        BigDecimal amount = position.getQuantity() != null ? position.getQuantity() : BigDecimal.ZERO;
        BigDecimal rate = usableRate(exchangeRate);
        ValuationError error = rate == null ? ValuationError.EXCHANGE_RATE_UNAVAILABLE : null;
        BigDecimal valueIdr;
        BigDecimal valueUsd;
        if (position.getCurrency() == PriceCurrency.USD) {
            valueUsd = usd(amount);
            valueIdr = rate == null ? BigDecimal.ZERO : idr(amount.multiply(rate));
        } else {
            valueIdr = idr(amount);
            valueUsd = rate == null ? BigDecimal.ZERO.setScale(USD_SCALE) : toUsd(amount, rate);
        }
        return new Valuation(valueIdr, valueUsd, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO.setScale(USD_SCALE),
                BigDecimal.ZERO.setScale(PERCENT_SCALE), BigDecimal.ONE, error);
    }

    public static PriceCurrency nativeCurrency(Position position) {
        return switch (position.getAssetClass()) {
            case STOCK -> position.effectiveMarket() == Market.DOMESTIC ? PriceCurrency.IDR : PriceCurrency.USD;
            case GOLD -> PriceCurrency.IDR;
            case CRYPTO -> PriceCurrency.USD;
            case CASH -> position.getCurrency() != null ? position.getCurrency() : PriceCurrency.IDR;
        };
    }

    static BigDecimal units(Position position) {
        BigDecimal quantity = position.getQuantity() != null ? position.getQuantity() : BigDecimal.ZERO;
        if (position.getAssetClass() == AssetClass.STOCK && position.effectiveMarket() == Market.DOMESTIC) {
            return quantity.multiply(BigDecimal.valueOf(SHARES_PER_LOT));
        }
        return quantity;
    }

    /** A manual price wins over the fetched one; a non-positive fetched price counts as absent. */
    private static BigDecimal effectivePrice(Position position, ResolvedPrice resolvedPrice) {
        if (position.hasManualPrice()) {
            return position.getManualPrice();
        }
        if (resolvedPrice == null || resolvedPrice.price().signum() <= 0) {
            return null;
        }
        return resolvedPrice.price();
    }

    private static BigDecimal usableRate(ExchangeRate exchangeRate) {
        return exchangeRate != null && exchangeRate.isUsable() ? exchangeRate.rate() : null;
    }

    static BigDecimal gainPercent(BigDecimal gain, BigDecimal cost) {
        if (cost.signum() == 0) {
            return BigDecimal.ZERO.setScale(PERCENT_SCALE);
        }
        return gain.multiply(HUNDRED).divide(cost, PERCENT_SCALE, RoundingMode.HALF_UP);
    }

    private static BigDecimal toUsd(BigDecimal idrAmount, BigDecimal rate) {
        return idrAmount.divide(rate, USD_SCALE, RoundingMode.HALF_UP);
    }

    static BigDecimal idr(BigDecimal amount) {
        return amount.setScale(IDR_SCALE, RoundingMode.HALF_UP);
    }

    static BigDecimal usd(BigDecimal amount) {
        return amount.setScale(USD_SCALE, RoundingMode.HALF_UP);
    }
}
