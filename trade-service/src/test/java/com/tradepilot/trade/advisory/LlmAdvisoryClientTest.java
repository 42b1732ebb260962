package com.tradepilot.trade.advisory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradepilot.common.exception.EngineException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class LlmAdvisoryClientTest {

    @Test
    @DisplayName("audit prompt offers exactly the grades the validator accepts")
    void auditPromptRatings() {
        String prompt = LlmAdvisoryClient.auditPrompt(62.5, new BigDecimal("41.257"));

        assertTrue(prompt.contains("\"rating\": \"S|A|B|C|D|F\""), prompt);
        assertTrue(prompt.contains("Net PnL $41.26"), prompt);
        for (String rating : AdvisoryValidator.RATINGS) {
            AuditResponse response = new AuditResponse(rating, 50.0, "ok", "");
            assertEquals(rating, AdvisoryValidator.toAudit(response).rating());
        }
    }

    @Test
    @DisplayName("without an API key every call fails immediately")
    void noApiKey() {
        LlmAdvisoryClient client = new LlmAdvisoryClient(WebClient.create("http://localhost:1"), new ObjectMapper());

        StepVerifier.create(client.requestAudit(50.0, BigDecimal.ONE))
            .expectError(EngineException.class)
            .verify();
    }
}
