package com.tradepilot.trade.advisory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradepilot.common.exception.EngineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Advisory client backed by the Anthropic messages API.
 *
 * <p>The model is asked for a bare JSON object; any prose or code fences around it are
 * stripped before parsing. Without an API key every call fails immediately, which
 * sends the pipeline straight to its local fallback.
 */
@Component
public class LlmAdvisoryClient implements AdvisoryClient {

    private static final Logger log = LoggerFactory.getLogger(LlmAdvisoryClient.class);
    private static final int MAX_TOKENS = 400;

    private final WebClient advisoryClient;
    private final ObjectMapper objectMapper;

    @Value("${advisory.api-key:}")
    private String apiKey;

    @Value("${advisory.model:claude-3-5-haiku-latest}")
    private String model;

    public LlmAdvisoryClient(@Qualifier("advisoryWebClient") WebClient advisoryClient, ObjectMapper objectMapper) {
        this.advisoryClient = advisoryClient;
        this.objectMapper   = objectMapper;
    }

    @Override
    public Mono<AdvisoryResponse> requestInsight(InsightRequest request) {
        String marketContext = request.hasQuote()
            ? String.format(Locale.ROOT, "Current Price: $%s. 24h Change: %.2f%%.", request.currentPrice(),
                            request.pctChange24h() != null ? request.pctChange24h() : 0.0)
            : "Market data unavailable, assume neutral consolidation.";
        String prompt = """
            Act as a senior crypto quant trader. Analyze %s. %s
            Provide a strategic insight with a confidence score (0-100), an action (BUY, SELL or HOLD),
            support and resistance levels, and technical reasoning.

            Respond ONLY with a JSON object in this exact format:
            {
              "pair": "%s",
              "confidence": 0-100,
              "action": "BUY|SELL|HOLD",
              "reasoning": "your rationale here",
              "keyLevels": { "support": <price>, "resistance": <price> }
            }
            """.formatted(request.pair(), marketContext, request.pair());

        return complete(prompt)
            .map(text -> parse(text, AdvisoryResponse.class))
            .doOnSuccess(r -> log.info("[Advisory] Insight received. pair={} action={} confidence={}",
                                       request.pair(), r.action(), r.confidence()));
    }

    @Override
    public Mono<AuditResponse> requestAudit(double winRatePct, BigDecimal netPnl) {
        String prompt = auditPrompt(winRatePct, netPnl);

        return complete(prompt)
            .map(text -> parse(text, AuditResponse.class))
            .doOnSuccess(r -> log.info("[Advisory] Audit received. rating={} efficiencyScore={}",
                                       r.rating(), r.efficiencyScore()));
    }

    static String auditPrompt(double winRatePct, BigDecimal netPnl) {
        return """
            Audit this trading bot's performance: Win Rate %.1f%%, Net PnL $%s.

            Respond ONLY with a JSON object in this exact format:
            {
              "rating": "%s",
              "efficiencyScore": 0-100,
              "critique": "one paragraph",
              "recommendedAdjustment": "one sentence"
            }
            """.formatted(winRatePct, netPnl.setScale(2, RoundingMode.HALF_UP).toPlainString(),
                          String.join("|", AdvisoryValidator.RATINGS));
    }

    private Mono<String> complete(String prompt) {
        if (apiKey == null || apiKey.isBlank()) {
            return Mono.error(new EngineException("Advisory", "no API key configured"));
        }
        Map<String, Object> requestBody = Map.of(
            "model", model,
            "max_tokens", MAX_TOKENS,
            "messages", List.of(Map.of("role", "user", "content", prompt))
        );

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(requestBody))
            .flatMap(bodyJson ->
                advisoryClient.post()
                    .uri("/v1/messages")
                    .header("x-api-key", apiKey)
                    .bodyValue(bodyJson)
                    .retrieve()
                    .bodyToMono(String.class)
            )
            .map(response -> {
                try {
                    JsonNode root = objectMapper.readTree(response);
                    String text = root.path("content").path(0).path("text").asText("");
                    if (text.isBlank()) {
                        throw new MalformedAdvisoryException("empty completion");
                    }
                    return text;
                } catch (MalformedAdvisoryException e) {
                    throw e;
                } catch (Exception e) {
                    throw new EngineException("Advisory", "failed to extract text from response", e);
                }
            });
    }

    private <T> T parse(String text, Class<T> type) {
        try {
            return objectMapper.readValue(sanitizeJson(text), type);
        } catch (Exception e) {
            throw new MalformedAdvisoryException("unparseable " + type.getSimpleName() + ": " + e.getMessage());
        }
    }

    /** Cuts the outermost JSON object out of a completion, dropping fences and prose. */
    static String sanitizeJson(String text) {
        if (text == null || text.isBlank()) {
            return "{}";
        }
        int open  = text.indexOf('{');
        int close = text.lastIndexOf('}');
        if (open != -1 && close > open) {
            return text.substring(open, close + 1);
        }
        return text.replace("```json", "").replace("```", "").trim();
    }
}
