package com.tradepilot.trade.advisory;

import reactor.core.publisher.Mono;

import java.math.BigDecimal;

/**
 * External recommendation service. Calls may be slow, fail, or return garbage;
 * {@link DecisionPipeline} bounds and validates them.
 */
public interface AdvisoryClient {

    Mono<AdvisoryResponse> requestInsight(InsightRequest request);

    /**
     * @param winRatePct win rate over closed trades, in percent
     * @param netPnl     sum of realised PnL
     */
    Mono<AuditResponse> requestAudit(double winRatePct, BigDecimal netPnl);
}
