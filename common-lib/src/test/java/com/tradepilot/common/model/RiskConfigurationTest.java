package com.tradepilot.common.model;

import com.tradepilot.common.exception.TradeRejectedException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class RiskConfigurationTest {

    @Test
    @DisplayName("defaults are valid and flagged as factory values")
    void defaults() {
        RiskConfiguration defaults = RiskConfiguration.defaults().validate();
        assertTrue(defaults.isFactoryDefault());
        assertEquals(0.02, defaults.advisoryRiskFraction(), 1e-12);
        assertEquals("", defaults.proxyPrefix());
    }

    @Test
    @DisplayName("non-positive limits are rejected")
    void rejectsInvalid() {
        assertThrows(TradeRejectedException.class,
            () -> new RiskConfiguration(0, 5, 15, 2, BigDecimal.TEN, false, "").validate());
        assertThrows(TradeRejectedException.class,
            () -> new RiskConfiguration(2, 5, -1, 2, BigDecimal.TEN, false, "").validate());
        assertThrows(TradeRejectedException.class,
            () -> new RiskConfiguration(2, 5, 15, 150, BigDecimal.TEN, false, "").validate());
        assertThrows(TradeRejectedException.class,
            () -> new RiskConfiguration(2, 5, 15, 2, new BigDecimal("-1"), false, "").validate());
    }

    @Test
    @DisplayName("proxy prefix only applies when enabled and non-blank")
    void proxyPrefix() {
        assertEquals("https://proxy/", new RiskConfiguration(2, 5, 15, 2, BigDecimal.TEN, true, "https://proxy/").proxyPrefix());
        assertEquals("", new RiskConfiguration(2, 5, 15, 2, BigDecimal.TEN, true, " ").proxyPrefix());
        assertEquals("", new RiskConfiguration(2, 5, 15, 2, BigDecimal.TEN, false, "https://proxy/").proxyPrefix());
    }
}
