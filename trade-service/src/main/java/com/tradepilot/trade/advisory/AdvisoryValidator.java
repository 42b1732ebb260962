package com.tradepilot.trade.advisory;

import com.tradepilot.common.model.Insight;
import com.tradepilot.common.model.KeyLevels;
import com.tradepilot.common.model.PerformanceAudit;
import com.tradepilot.common.model.Provenance;
import com.tradepilot.common.model.SignalAction;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Turns raw advisory answers into domain objects, rejecting anything incomplete or
 * out of range with {@link MalformedAdvisoryException}.
 */
public final class AdvisoryValidator {

    /** Audit grades, best first. */
    static final List<String> RATINGS = List.of("S", "A", "B", "C", "D", "F");

    private AdvisoryValidator() {}

    public static Insight toInsight(String requestedPair, AdvisoryResponse response, Instant timestamp) {
        if (response == null) {
            throw new MalformedAdvisoryException("empty advisory response");
        }
        if (response.pair() == null || response.pair().isBlank()) {
            throw new MalformedAdvisoryException("pair missing");
        }
        Double confidence = response.confidence();
        if (confidence == null || !Double.isFinite(confidence) || confidence < 0 || confidence > 100) {
            throw new MalformedAdvisoryException("confidence out of range: " + confidence);
        }
        SignalAction action = SignalAction.parse(response.action())
            .orElseThrow(() -> new MalformedAdvisoryException("unknown action: " + response.action()));
        if (response.reasoning() == null || response.reasoning().isBlank()) {
            throw new MalformedAdvisoryException("reasoning missing");
        }
        AdvisoryResponse.Levels levels = response.keyLevels();
        if (levels == null || !isPositive(levels.support()) || !isPositive(levels.resistance())) {
            throw new MalformedAdvisoryException("key levels missing or non-positive");
        }

        return new Insight(requestedPair, (int) Math.round(confidence), action, response.reasoning().trim(),
                           new KeyLevels(levels.support(), levels.resistance()), timestamp, Provenance.EXTERNAL);
    }

    public static PerformanceAudit toAudit(AuditResponse response) {
        if (response == null) {
            throw new MalformedAdvisoryException("empty audit response");
        }
        String rating = response.rating() == null ? "" : response.rating().trim().toUpperCase(Locale.ROOT);
        if (!RATINGS.contains(rating)) {
            throw new MalformedAdvisoryException("unknown rating: " + response.rating());
        }
        Double score = response.efficiencyScore();
        if (score == null || !Double.isFinite(score) || score < 0 || score > 100) {
            throw new MalformedAdvisoryException("efficiency score out of range: " + score);
        }
        if (response.critique() == null || response.critique().isBlank()) {
            throw new MalformedAdvisoryException("critique missing");
        }
        String adjustment = response.recommendedAdjustment() == null ? "" : response.recommendedAdjustment().trim();
        return new PerformanceAudit(rating, (int) Math.round(score), response.critique().trim(), adjustment,
                                    Provenance.EXTERNAL);
    }

    private static boolean isPositive(Double value) {
        return value != null && Double.isFinite(value) && value > 0;
    }
}
