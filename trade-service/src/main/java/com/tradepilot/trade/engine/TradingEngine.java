package com.tradepilot.trade.engine;

import com.tradepilot.common.analysis.TrendAnalyzer;
import com.tradepilot.common.exception.TradeRejectedException;
import com.tradepilot.common.model.AccountMode;
import com.tradepilot.common.model.PriceQuote;
import com.tradepilot.common.model.RiskConfiguration;
import com.tradepilot.common.model.SafetyState;
import com.tradepilot.common.model.SignalAction;
import com.tradepilot.common.model.Trade;
import com.tradepilot.common.model.TradeSide;
import com.tradepilot.common.model.TrendSignal;
import com.tradepilot.common.money.MoneyUtils;
import com.tradepilot.common.risk.PositionSizer;
import com.tradepilot.trade.advisory.InsightRequest;
import com.tradepilot.trade.config.EngineProperties;
import com.tradepilot.trade.ledger.Settlement;
import com.tradepilot.trade.ledger.TradeLedger;
import com.tradepilot.trade.marketdata.MarketSnapshot;
import com.tradepilot.trade.persistence.EngineSnapshot;
import com.tradepilot.trade.persistence.OperatorSession;
import com.tradepilot.trade.persistence.PersistenceStore;
import com.tradepilot.trade.risk.GovernorDecision;
import com.tradepilot.trade.risk.RiskGovernor;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Single owner of all mutable trading state: ledger, balances, governor counters,
 * market board, risk configuration, account mode and operator session.
 *
 * <p>Every public operation is queued onto one dedicated thread
 * ({@code trading-engine}), so a settlement and an open on the same pair can never
 * interleave. Callers receive a {@link Mono} that completes once the operation has run.
 *
 * <p>Periodic work (autopilot cycles, settlement sweeps, feed updates) only runs while
 * the engine is {@linkplain #activate() active}; a tick that was already queued when
 * the session ended finds the engine inactive and does nothing.
 */
@Service
public class TradingEngine {

    private static final Logger log = LoggerFactory.getLogger(TradingEngine.class);

    private final EngineProperties properties;
    private final PersistenceStore store;
    private final EventLog events;
    private final Clock clock;
    private final Scheduler engineScheduler = Schedulers.newSingle("trading-engine", true);

    private final RiskGovernor governor;
    private final TradeLedger ledger;
    private final MarketBoard board;

    private RiskConfiguration risk;
    private AccountMode mode = AccountMode.TRIAL;
    private OperatorSession session;
    private long feedLatencyMs;
    private boolean syntheticFeed;

    private volatile boolean active;

    public TradingEngine(EngineProperties properties, PersistenceStore store, EventLog events, Clock clock) {
        this.properties = properties;
        this.store      = store;
        this.events     = events;
        this.clock      = clock;

        EngineSnapshot snapshot = store.load();
        Map<AccountMode, BigDecimal> balances = new EnumMap<>(AccountMode.class);
        balances.put(AccountMode.TRIAL, orDefault(snapshot.getTrialBalance(), properties.getInitialTrialBalance()));
        balances.put(AccountMode.LIVE, orDefault(snapshot.getLiveBalance(), properties.getInitialLiveBalance()));

        this.governor = new RiskGovernor(properties.getMaxConsecutiveLosses());
        this.ledger   = new TradeLedger(balances, snapshot.getTrades() != null ? snapshot.getTrades() : List.of(),
                                        governor, clock);
        this.risk     = snapshot.getRiskConfiguration() != null ? snapshot.getRiskConfiguration() : RiskConfiguration.defaults();
        this.session  = snapshot.getSession();
        this.board    = new MarketBoard(properties.getHistoryCapacity());
        this.board.seed(properties.getPairs(), clock.instant());

        log.info("[Engine] Initialised. pairs={} trades={} trialBalance={} liveBalance={}",
                 properties.getPairs(), ledger.trades().size(),
                 balances.get(AccountMode.TRIAL), balances.get(AccountMode.LIVE));
    }

    // ── session gate ──────────────────────────────────────────────────────────

    public void activate() {
        active = true;
    }

    public void deactivate() {
        active = false;
    }

    public boolean isActive() {
        return active;
    }

    // ── operator commands ─────────────────────────────────────────────────────

    /**
     * Opens a manual position in the current account. When {@code price} is null the
     * latest quote for the pair is used. The sizer is not applied.
     */
    public Mono<Trade> openTrade(String pair, TradeSide side, BigDecimal amount, BigDecimal price) {
        return submit(() -> {
            BigDecimal fill = price != null
                ? price
                : board.latestPrice(pair).orElseThrow(() ->
                    new TradeRejectedException("TradingEngine", "no price known for " + pair));
            Trade trade = ledger.open(pair, side, amount, fill, risk, mode);
            events.success(String.format("Order executed: %s %s %s @ %s", side, pair,
                                         trade.amount().toPlainString(), fill.toPlainString()));
            persist();
            return trade;
        });
    }

    /**
     * Closes a trade at the latest quote of its pair (entry price when none is known).
     * Completes empty when the trade is unknown or already CLOSED.
     */
    public Mono<Trade> closeTrade(String tradeId) {
        return submit(() -> {
            Trade trade = ledger.find(tradeId).orElse(null);
            if (trade == null || !trade.isOpen()) {
                return null;
            }
            BigDecimal exit = board.latestPrice(trade.pair()).orElse(trade.entryPrice());
            Settlement settlement = ledger.manualClose(tradeId, exit).orElse(null);
            if (settlement == null) {
                return null;
            }
            recordSettlementEvent(settlement);
            persist();
            return settlement.trade();
        });
    }

    public Mono<SafetyState> setAutopilot(boolean enabled) {
        return submit(() -> {
            governor.setAutopilotEnabled(enabled);
            if (enabled) {
                events.advisory("Autopilot engaged. Scanning " + properties.getPairs().size() + " pairs.");
            } else {
                events.info("Autopilot disengaged.");
            }
            log.info("[Engine] Autopilot toggled. enabled={}", enabled);
            return governor.snapshot();
        });
    }

    /** Clears the safety alert and the loss streak; cumulative PnL is left as is. */
    public Mono<SafetyState> dismissAlert() {
        return submit(() -> {
            governor.dismissAlert();
            events.info("Safety alert dismissed. Loss streak reset.");
            return governor.snapshot();
        });
    }

    /**
     * Replaces the live risk configuration. Positions already open keep the thresholds
     * captured when they opened.
     *
     * @throws TradeRejectedException (through the Mono) when the configuration is invalid
     */
    public Mono<RiskConfiguration> updateRiskConfiguration(RiskConfiguration update) {
        return submit(() -> {
            if (update == null) {
                throw new TradeRejectedException("TradingEngine", "risk configuration is required");
            }
            risk = update.validate();
            if (risk.isFactoryDefault()) {
                events.info("Risk configuration reset to factory defaults.");
            } else {
                events.info(String.format("Risk configuration updated. SL %.2f%% TP %.2f%% DD %.2f%%",
                                          risk.stopLossPct(), risk.takeProfitPct(), risk.maxDrawdownPct()));
            }
            persist();
            return risk;
        });
    }

    public Mono<AccountMode> setMode(AccountMode newMode) {
        return submit(() -> {
            if (newMode == null) {
                throw new TradeRejectedException("TradingEngine", "mode is required");
            }
            if (newMode != mode) {
                mode = newMode;
                events.info("Switched to " + newMode + " account.");
            }
            return mode;
        });
    }

    public Mono<OperatorSession> startSession(OperatorSession operator) {
        return submit(() -> {
            session = operator;
            events.info("Operator session started" + (operator.name() != null ? " for " + operator.name() : "") + ".");
            persist();
            return operator;
        });
    }

    /** Forgets the operator and turns autopilot off. */
    public Mono<SafetyState> endSession() {
        return submit(() -> {
            session = null;
            governor.setAutopilotEnabled(false);
            events.info("Operator session ended. Periodic tasks stopped.");
            persist();
            return governor.snapshot();
        });
    }

    // ── periodic work ─────────────────────────────────────────────────────────

    /**
     * One autopilot cycle against the current account. Consults the governor first; a
     * halt disables autopilot and raises the alert. Otherwise each pair with enough
     * history, no OPEN position in this account and a BUY trend gets a sized long entry
     * when the sized notional exceeds {@code engine.min-notional}.
     *
     * @return trades opened by this cycle
     */
    public Mono<List<Trade>> runAutopilotCycle() {
        return submit(() -> {
            if (!active || !governor.isAutopilotEnabled()) {
                return List.<Trade>of();
            }
            GovernorDecision decision = governor.evaluate(ledger.balance(mode), risk.maxDrawdownPct());
            if (decision.isHalt()) {
                events.warning(governor.snapshot().alert());
                return List.<Trade>of();
            }

            List<Trade> opened = new ArrayList<>();
            for (String pair : properties.getPairs()) {
                List<Double> history = board.history(pair);
                if (history.size() < properties.getMinAutopilotHistory() || ledger.hasOpenPosition(pair, mode)) {
                    continue;
                }
                TrendSignal signal = TrendAnalyzer.analyzeTrend(history);
                if (signal.action() != SignalAction.BUY) {
                    continue;
                }
                BigDecimal price = board.latestPrice(pair).orElse(null);
                if (!MoneyUtils.isPositive(price)) {
                    continue;
                }
                BigDecimal size = PositionSizer.safeSize(ledger.balance(mode), price,
                                                         risk.advisoryRiskFraction(), risk.advisoryMaxPosition());
                if (size.compareTo(properties.getMinNotional()) <= 0) {
                    log.debug("[Autopilot] Entry below minimum notional. pair={} size={}", pair, size);
                    continue;
                }
                Trade trade = ledger.open(pair, TradeSide.BUY, size, price, risk, mode);
                opened.add(trade);
                log.info("[Autopilot] Entry opened. pair={} notional={} price={} confidence={}",
                         pair, size, price, signal.confidence());
                events.advisory(String.format("Autopilot: LONG %s notional %s @ %s (confidence %d%%)",
                                              pair, size.toPlainString(), price.toPlainString(), signal.confidence()));
            }
            if (!opened.isEmpty()) {
                persist();
            }
            return List.copyOf(opened);
        });
    }

    /**
     * Settles every OPEN trade, in both accounts, whose captured stop-loss or
     * take-profit has been crossed by the latest quote.
     */
    public Mono<List<Settlement>> runSettlementSweep() {
        return submit(() -> {
            if (!active) {
                return List.<Settlement>of();
            }
            List<Settlement> settled = ledger.settleTriggered(board.latestPrices());
            settled.forEach(this::recordSettlementEvent);
            if (!settled.isEmpty()) {
                persist();
            }
            return settled;
        });
    }

    /** Folds one market poll into the board. */
    public Mono<Map<String, PriceQuote>> applyMarketSnapshot(MarketSnapshot snapshot) {
        return submit(() -> {
            if (!active) {
                return board.quotes();
            }
            if (snapshot.synthetic() && !syntheticFeed) {
                events.warning("Market feed unreachable. Synthetic prices active.");
            } else if (!snapshot.synthetic() && syntheticFeed) {
                events.success("Market feed restored.");
            }
            syntheticFeed = snapshot.synthetic();
            feedLatencyMs = snapshot.latencyMs();
            for (PriceQuote quote : snapshot.quotes().values()) {
                if (MoneyUtils.isPositive(quote.price())) {
                    board.apply(quote);
                }
            }
            return board.quotes();
        });
    }

    // ── queries ───────────────────────────────────────────────────────────────

    public Mono<AccountMode> currentMode() {
        return submit(() -> mode);
    }

    public Mono<BigDecimal> balance(AccountMode account) {
        return submit(() -> ledger.balance(account != null ? account : mode));
    }

    public Mono<Map<AccountMode, BigDecimal>> balances() {
        return submit(ledger::balances);
    }

    /** Trades of {@code account} (current account when null), newest first. */
    public Mono<List<Trade>> trades(AccountMode account) {
        return submit(() -> ledger.trades(account != null ? account : mode));
    }

    public Mono<Map<String, PriceQuote>> quotes() {
        return submit(board::quotes);
    }

    public Mono<List<Double>> history(String pair) {
        return submit(() -> board.history(pair));
    }

    public Mono<SafetyState> safety() {
        return submit(governor::snapshot);
    }

    public Mono<RiskConfiguration> riskConfiguration() {
        return submit(() -> risk);
    }

    public Mono<OperatorSession> session() {
        return submit(() -> session);
    }

    public Mono<EngineStatus> status() {
        return submit(() -> new EngineStatus(mode, active, governor.isAutopilotEnabled(), feedLatencyMs,
                                             syntheticFeed, ledger.openTrades().size()));
    }

    /** What the engine knows about {@code pair}, ready for the decision pipeline. */
    public Mono<InsightRequest> insightRequest(String pair) {
        return submit(() -> {
            PriceQuote quote = board.latest(pair).orElse(null);
            return new InsightRequest(pair,
                quote != null ? quote.price().doubleValue() : null,
                quote != null ? quote.pctChange24h() : null,
                board.history(pair));
        });
    }

    @PreDestroy
    public void shutdown() {
        active = false;
        engineScheduler.dispose();
        log.info("[Engine] Shut down.");
    }

    // ── internals ─────────────────────────────────────────────────────────────

    private <T> Mono<T> submit(Callable<T> task) {
        return Mono.fromCallable(task).subscribeOn(engineScheduler);
    }

    private void recordSettlementEvent(Settlement settlement) {
        Trade trade = settlement.trade();
        String reason = settlement.manual() ? "manual"
            : settlement.pnlPercent().signum() >= 0 ? "take-profit" : "stop-loss";
        String message = String.format("Trade closed: %s | PnL: %s$%s (%s)", trade.pair(),
            settlement.pnlValue().signum() >= 0 ? "+" : "-",
            settlement.pnlValue().abs().setScale(2, RoundingMode.HALF_UP).toPlainString(), reason);
        if (settlement.pnlValue().signum() >= 0) {
            events.success(message);
        } else {
            events.warning(message);
        }
    }

    private void persist() {
        Map<AccountMode, BigDecimal> balances = ledger.balances();
        store.save(new EngineSnapshot(ledger.trades(), risk, balances.get(AccountMode.TRIAL),
                                      balances.get(AccountMode.LIVE), session));
    }

    private static BigDecimal orDefault(BigDecimal value, BigDecimal fallback) {
        return value != null ? value : fallback;
    }
}
