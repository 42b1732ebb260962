package com.tradepilot.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradepilot.common.money.MoneyUtils;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Instant;

/**
 * A single simulated position.
 *
 * <p>Immutable: {@link #close} returns a new CLOSED copy and a CLOSED trade cannot be
 * closed again. Exit thresholds ({@code stopLossPct}, {@code takeProfitPct}) and the
 * derived trigger prices are captured from the {@link RiskConfiguration} in force at
 * open time.
 *
 * @param id              unique identifier
 * @param pair            pair symbol
 * @param side            BUY (long) or SELL (short)
 * @param entryPrice      fill price at open
 * @param exitPrice       fill price at close, {@code null} while OPEN
 * @param amount          notional committed from the account balance
 * @param status          OPEN or CLOSED
 * @param pnl             realised PnL, {@code null} while OPEN
 * @param openedAt        open time
 * @param stopLossPrice   price at which the stop-loss triggers
 * @param takeProfitPrice price at which the take-profit triggers
 * @param stopLossPct     stop-loss threshold snapshotted at open
 * @param takeProfitPct   take-profit threshold snapshotted at open
 * @param accountMode     TRIAL or LIVE, fixed at open
 */
public record Trade(
    @JsonProperty("id")              String id,
    @JsonProperty("pair")            String pair,
    @JsonProperty("side")            TradeSide side,
    @JsonProperty("entryPrice")      BigDecimal entryPrice,
    @JsonProperty("exitPrice")       BigDecimal exitPrice,
    @JsonProperty("amount")          BigDecimal amount,
    @JsonProperty("status")          TradeStatus status,
    @JsonProperty("pnl")             BigDecimal pnl,
    @JsonProperty("openedAt")        Instant openedAt,
    @JsonProperty("stopLossPrice")   BigDecimal stopLossPrice,
    @JsonProperty("takeProfitPrice") BigDecimal takeProfitPrice,
    @JsonProperty("stopLossPct")     double stopLossPct,
    @JsonProperty("takeProfitPct")   double takeProfitPct,
    @JsonProperty("accountMode")     AccountMode accountMode
) {

    /**
     * Creates an OPEN trade with exit levels derived from {@code risk}.
     * For a long the stop sits below entry and the target above; a short mirrors both.
     */
    public static Trade open(String id, String pair, TradeSide side, BigDecimal amount, BigDecimal price,
                             RiskConfiguration risk, AccountMode mode, Instant openedAt) {
        BigDecimal stopOffset   = BigDecimal.valueOf(risk.stopLossPct()).divide(MoneyUtils.HUNDRED, MathContext.DECIMAL64);
        BigDecimal targetOffset = BigDecimal.valueOf(risk.takeProfitPct()).divide(MoneyUtils.HUNDRED, MathContext.DECIMAL64);
        BigDecimal sign = BigDecimal.valueOf(side.sign());

        BigDecimal stopLossPrice   = MoneyUtils.scale(price.multiply(BigDecimal.ONE.subtract(stopOffset.multiply(sign))));
        BigDecimal takeProfitPrice = MoneyUtils.scale(price.multiply(BigDecimal.ONE.add(targetOffset.multiply(sign))));

        return new Trade(id, pair, side, price, null, MoneyUtils.scale(amount), TradeStatus.OPEN, null, openedAt,
            stopLossPrice, takeProfitPrice, risk.stopLossPct(), risk.takeProfitPct(), mode);
    }

    @JsonIgnore
    public boolean isOpen() {
        return status == TradeStatus.OPEN;
    }

    /** Signed percentage move from entry to {@code price}, positive when the position gains. */
    public BigDecimal pnlPercentAt(BigDecimal price) {
        BigDecimal change = MoneyUtils.percentChange(entryPrice, price);
        return side.sign() > 0 ? change : change.negate();
    }

    /** Money PnL of the whole notional if the position were closed at {@code price}. */
    public BigDecimal pnlValueAt(BigDecimal price) {
        return MoneyUtils.percentOf(amount, pnlPercentAt(price));
    }

    /** True when {@code price} crosses the stop-loss or take-profit captured at open. */
    public boolean exitTriggeredAt(BigDecimal price) {
        BigDecimal pct = pnlPercentAt(price);
        return pct.compareTo(BigDecimal.valueOf(-stopLossPct)) <= 0
            || pct.compareTo(BigDecimal.valueOf(takeProfitPct)) >= 0;
    }

    /**
     * @throws IllegalStateException if this trade is already CLOSED
     */
    public Trade close(BigDecimal exit, BigDecimal realisedPnl) {
        if (!isOpen()) {
            throw new IllegalStateException("Trade " + id + " is already closed");
        }
        return new Trade(id, pair, side, entryPrice, exit, amount, TradeStatus.CLOSED, realisedPnl, openedAt,
            stopLossPrice, takeProfitPrice, stopLossPct, takeProfitPct, accountMode);
    }

    /** Copy with a mode assigned; used for legacy records persisted before modes existed. */
    public Trade withAccountMode(AccountMode mode) {
        return new Trade(id, pair, side, entryPrice, exitPrice, amount, status, pnl, openedAt,
            stopLossPrice, takeProfitPrice, stopLossPct, takeProfitPct, mode);
    }
}
