package com.tradepilot.trade.advisory;

import com.tradepilot.common.analysis.TrendAnalyzer;
import com.tradepilot.common.model.Insight;
import com.tradepilot.common.model.KeyLevels;
import com.tradepilot.common.model.PerformanceAudit;
import com.tradepilot.common.model.Provenance;
import com.tradepilot.common.model.SignalAction;
import com.tradepilot.common.model.Trade;
import com.tradepilot.common.model.TradeStatus;
import com.tradepilot.common.model.TrendSignal;
import com.tradepilot.common.money.MoneyUtils;
import com.tradepilot.trade.config.EngineProperties;
import com.tradepilot.trade.engine.EventLog;
import com.tradepilot.trade.marketdata.AssetProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Races the advisory service against a timer and falls back to local analysis.
 *
 * <p>Whatever happens upstream (timeout, transport error, empty or malformed answer)
 * the returned {@link Mono} emits exactly one usable result and never errors. On
 * timeout the advisory subscription is cancelled and the fallback is produced
 * immediately, without waiting for the late answer.
 *
 * <h3>Insight fallback</h3>
 * <pre>
 *   history ≥ min-advisory-history → TrendAnalyzer signal
 *   otherwise                      → 24h change &gt; 2 → BUY, &lt; −2 → SELL, else HOLD (confidence 70)
 *   key levels                     → floor(base × (1 ∓ volatility))
 * </pre>
 *
 * <h3>Audit fallback</h3>
 * <pre>
 *   winRate &gt; 60 and netPnl &gt; 0 → A
 *   netPnl &lt; 0                   → F
 *   otherwise                     → C        efficiencyScore = floor(winRate)
 * </pre>
 */
@Service
public class DecisionPipeline {

    private static final Logger log = LoggerFactory.getLogger(DecisionPipeline.class);

    static final int HEURISTIC_CONFIDENCE = 70;
    static final double HEURISTIC_CHANGE_PCT = 2.0;

    private final AdvisoryClient advisoryClient;
    private final EventLog events;
    private final Clock clock;
    private final Duration timeout;
    private final int minHistory;

    public DecisionPipeline(AdvisoryClient advisoryClient, EventLog events, Clock clock, EngineProperties properties) {
        this.advisoryClient = advisoryClient;
        this.events         = events;
        this.clock          = clock;
        this.timeout        = properties.getAdvisoryTimeout();
        this.minHistory     = properties.getMinAdvisoryHistory();
    }

    public Mono<Insight> generateInsight(InsightRequest request) {
        return Mono.defer(() -> advisoryClient.requestInsight(request))
            .map(response -> AdvisoryValidator.toInsight(request.pair(), response, clock.instant()))
            .switchIfEmpty(Mono.error(() -> new MalformedAdvisoryException("no insight returned")))
            .timeout(timeout)
            .onErrorResume(e -> {
                log.warn("[DecisionPipeline] Advisory unavailable, using local analysis. pair={} reason={}",
                         request.pair(), e.getMessage());
                return Mono.fromCallable(() -> fallbackInsight(request));
            })
            .doOnNext(insight -> events.advisory(String.format("Insight %s: %s (%d%%) via %s",
                insight.pair(), insight.action(), insight.confidence(), insight.provenance())));
    }

    /**
     * Grades the closed trades in {@code trades}; OPEN trades are ignored.
     */
    public Mono<PerformanceAudit> auditPerformance(List<Trade> trades) {
        List<Trade> closed = trades.stream().filter(t -> t.status() == TradeStatus.CLOSED).toList();
        long wins = closed.stream().filter(t -> t.pnl() != null && t.pnl().signum() > 0).count();
        double winRate = closed.isEmpty() ? 0.0 : wins * 100.0 / closed.size();
        BigDecimal netPnl = closed.stream()
            .map(t -> t.pnl() != null ? t.pnl() : BigDecimal.ZERO)
            .reduce(MoneyUtils.ZERO, MoneyUtils::add);

        return Mono.defer(() -> advisoryClient.requestAudit(winRate, netPnl))
            .map(AdvisoryValidator::toAudit)
            .switchIfEmpty(Mono.error(() -> new MalformedAdvisoryException("no audit returned")))
            .timeout(timeout)
            .onErrorResume(e -> {
                log.warn("[DecisionPipeline] Audit unavailable, using rule-based grade. closed={} reason={}",
                         closed.size(), e.getMessage());
                return Mono.fromCallable(() -> fallbackAudit(winRate, netPnl));
            });
    }

    Insight fallbackInsight(InsightRequest request) {
        AssetProfile profile = AssetProfile.forPair(request.pair());
        double base = request.hasQuote() ? request.currentPrice() : profile.referencePrice();

        SignalAction action;
        int confidence;
        String reason;
        if (request.history().size() >= minHistory) {
            TrendSignal signal = TrendAnalyzer.analyzeTrend(request.history());
            action     = signal.action();
            confidence = signal.confidence();
            reason     = signal.reason();
        } else {
            double change = request.pctChange24h() != null && Double.isFinite(request.pctChange24h())
                ? request.pctChange24h() : 0.0;
            action = change > HEURISTIC_CHANGE_PCT ? SignalAction.BUY
                   : change < -HEURISTIC_CHANGE_PCT ? SignalAction.SELL
                   : SignalAction.HOLD;
            confidence = HEURISTIC_CONFIDENCE;
            reason     = "Momentum analysis via 24h price deviation.";
        }

        KeyLevels levels = new KeyLevels(Math.floor(base * (1 - profile.volatility())),
                                         Math.floor(base * (1 + profile.volatility())));
        return new Insight(request.pair(), confidence, action, "[Local analysis] " + reason + " (advisory bypassed)",
                           levels, clock.instant(), Provenance.FALLBACK);
    }

    static PerformanceAudit fallbackAudit(double winRate, BigDecimal netPnl) {
        String rating = "C";
        String critique = "Performance is following market baseline. Edge is neutral.";
        if (winRate > 60 && netPnl.signum() > 0) {
            rating = "A";
            critique = "Alpha generation confirmed. Positive expectancy.";
        } else if (netPnl.signum() < 0) {
            rating = "F";
            critique = "Negative expectancy detected. Tighten stop-loss logic.";
        }
        return new PerformanceAudit(rating, (int) Math.floor(winRate), "[Rule-based audit] " + critique,
                                    "Continue standard operation with adjusted risk sizing.", Provenance.FALLBACK);
    }
}
