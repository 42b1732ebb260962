package com.tradepilot.trade.ledger;

import com.tradepilot.common.exception.TradeRejectedException;
import com.tradepilot.common.model.AccountMode;
import com.tradepilot.common.model.RiskConfiguration;
import com.tradepilot.common.model.Trade;
import com.tradepilot.common.model.TradeSide;
import com.tradepilot.common.money.MoneyUtils;
import com.tradepilot.trade.risk.RiskGovernor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Book of trades and per-mode balances.
 *
 * <p>Opening debits the committed amount from the trade's account; settling credits
 * the amount plus realised PnL back to the same account and reports the PnL to the
 * {@link RiskGovernor}. For each mode the balance therefore always equals the
 * initial balance minus open amounts plus realised PnL.
 *
 * <p>Not thread-safe; owned by the single engine thread.
 */
public class TradeLedger {

    private static final Logger log = LoggerFactory.getLogger(TradeLedger.class);

    private final Map<String, Trade> trades = new LinkedHashMap<>();
    private final Map<AccountMode, BigDecimal> balances = new EnumMap<>(AccountMode.class);
    private final RiskGovernor governor;
    private final Clock clock;

    public TradeLedger(Map<AccountMode, BigDecimal> initialBalances, List<Trade> history,
                       RiskGovernor governor, Clock clock) {
        this.governor = governor;
        this.clock    = clock;
        for (AccountMode mode : AccountMode.values()) {
            balances.put(mode, MoneyUtils.scale(initialBalances.getOrDefault(mode, BigDecimal.ZERO)));
        }
        // history arrives newest first
        List<Trade> chronological = new ArrayList<>(history);
        Collections.reverse(chronological);
        chronological.forEach(t -> trades.put(t.id(), t));
    }

    /**
     * Opens a position and debits {@code amount} from the {@code mode} balance.
     * The balance is not checked: manual trades may overdraw it.
     *
     * @throws TradeRejectedException when pair, side, amount or price is invalid
     */
    public Trade open(String pair, TradeSide side, BigDecimal amount, BigDecimal price,
                      RiskConfiguration risk, AccountMode mode) {
        if (pair == null || pair.isBlank()) {
            throw new TradeRejectedException("TradeLedger", "pair is required");
        }
        if (side == null) {
            throw new TradeRejectedException("TradeLedger", "side is required");
        }
        if (!MoneyUtils.isPositive(amount)) {
            throw new TradeRejectedException("TradeLedger", "amount must be positive, got " + amount);
        }
        if (!MoneyUtils.isPositive(price)) {
            throw new TradeRejectedException("TradeLedger", "price must be positive, got " + price);
        }

        Trade trade = Trade.open(UUID.randomUUID().toString(), pair, side, amount, price, risk, mode, clock.instant());
        trades.put(trade.id(), trade);
        balances.put(mode, MoneyUtils.subtract(balances.get(mode), trade.amount()));

        log.info("[TradeLedger] Trade opened. id={} pair={} side={} amount={} entry={} mode={} balance={}",
                 trade.id(), pair, side, trade.amount(), price, mode, balances.get(mode));
        return trade;
    }

    /**
     * Closes an OPEN trade at {@code exitPrice}. Unknown or already CLOSED trades are a
     * no-op and return empty; the balance and governor are untouched in that case.
     */
    public Optional<Settlement> close(String tradeId, BigDecimal exitPrice, boolean manual) {
        Trade trade = trades.get(tradeId);
        if (trade == null || !trade.isOpen()) {
            log.debug("[TradeLedger] Close ignored. id={} known={}", tradeId, trade != null);
            return Optional.empty();
        }
        if (!MoneyUtils.isPositive(exitPrice)) {
            throw new TradeRejectedException("TradeLedger", "exit price must be positive, got " + exitPrice);
        }

        BigDecimal pnlPercent = trade.pnlPercentAt(exitPrice);
        BigDecimal pnlValue   = trade.pnlValueAt(exitPrice);
        Trade closed = trade.close(exitPrice, pnlValue);
        trades.put(closed.id(), closed);

        AccountMode mode = closed.accountMode();
        BigDecimal balance = MoneyUtils.add(balances.get(mode), MoneyUtils.add(closed.amount(), pnlValue));
        balances.put(mode, balance);
        governor.recordSettlement(pnlValue);

        log.info("[TradeLedger] Trade settled. id={} pair={} exit={} pnlPct={} pnl={} mode={} balance={} manual={}",
                 closed.id(), closed.pair(), exitPrice, pnlPercent.doubleValue(), pnlValue, mode, balance, manual);
        return Optional.of(new Settlement(closed, pnlPercent, pnlValue, balance, manual));
    }

    /** Operator close at the latest known price. */
    public Optional<Settlement> manualClose(String tradeId, BigDecimal latestPrice) {
        return close(tradeId, latestPrice, true);
    }

    /**
     * Settles every OPEN trade, in either mode, whose captured stop-loss or take-profit
     * is crossed by the latest price of its pair. Pairs without a price are skipped.
     */
    public List<Settlement> settleTriggered(Map<String, BigDecimal> latestPrices) {
        List<Settlement> settled = new ArrayList<>();
        for (Trade trade : new ArrayList<>(trades.values())) {
            if (!trade.isOpen()) {
                continue;
            }
            BigDecimal price = latestPrices.get(trade.pair());
            if (!MoneyUtils.isPositive(price)) {
                continue;
            }
            if (trade.exitTriggeredAt(price)) {
                close(trade.id(), price, false).ifPresent(settled::add);
            }
        }
        return settled;
    }

    public Optional<Trade> find(String tradeId) {
        return Optional.ofNullable(trades.get(tradeId));
    }

    public boolean hasOpenPosition(String pair, AccountMode mode) {
        return trades.values().stream()
            .anyMatch(t -> t.isOpen() && t.accountMode() == mode && t.pair().equals(pair));
    }

    /** All trades, newest first. */
    public List<Trade> trades() {
        List<Trade> all = new ArrayList<>(trades.values());
        Collections.reverse(all);
        return all;
    }

    /** Trades of one account, newest first. */
    public List<Trade> trades(AccountMode mode) {
        return trades().stream().filter(t -> t.accountMode() == mode).toList();
    }

    public List<Trade> openTrades() {
        return trades().stream().filter(Trade::isOpen).toList();
    }

    public BigDecimal balance(AccountMode mode) {
        return balances.get(mode);
    }

    public Map<AccountMode, BigDecimal> balances() {
        return Collections.unmodifiableMap(new EnumMap<>(balances));
    }
}
