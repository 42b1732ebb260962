package com.tradepilot.trade.risk;

import com.tradepilot.common.model.SafetyState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class RiskGovernorTest {

    private static final BigDecimal BALANCE = new BigDecimal("10000");

    private RiskGovernor governor;

    @BeforeEach
    void setUp() {
        governor = new RiskGovernor(3);
        governor.setAutopilotEnabled(true);
    }

    private void record(String pnl) {
        governor.recordSettlement(new BigDecimal(pnl));
    }

    @Nested
    @DisplayName("consecutive losses")
    class StreakTests {

        @Test
        @DisplayName("gate stays open after two losses and closes after the third")
        void haltsOnThird() {
            record("-1");
            record("-1");
            assertEquals(GovernorDecision.ALLOW, governor.evaluate(BALANCE, 15));
            assertTrue(governor.isAutopilotEnabled());

            record("-1");
            assertEquals(GovernorDecision.HALT_CONSECUTIVE_LOSSES, governor.evaluate(BALANCE, 15));

            SafetyState state = governor.snapshot();
            assertFalse(state.autopilotEnabled());
            assertTrue(state.hasAlert());
            assertTrue(state.alert().contains("max consecutive losses reached"));
        }

        @Test
        @DisplayName("a win or break-even resets the streak")
        void winResets() {
            record("-5");
            record("-5");
            record("3");
            assertEquals(0, governor.snapshot().consecutiveLosses());
            record("-5");
            record("0");
            assertEquals(0, governor.snapshot().consecutiveLosses());
            assertEquals(0, new BigDecimal("-12").compareTo(governor.snapshot().cumulativePnl()));
        }

        @Test
        @DisplayName("halt does not re-enable itself on later evaluations")
        void staysHalted() {
            record("-1");
            record("-1");
            record("-1");
            governor.evaluate(BALANCE, 15);
            record("10");
            assertEquals(GovernorDecision.ALLOW, governor.evaluate(BALANCE, 15));
            assertFalse(governor.isAutopilotEnabled());
        }
    }

    @Nested
    @DisplayName("drawdown")
    class DrawdownTests {

        @Test
        @DisplayName("−16 % of balance breaches a 15 % limit")
        void breach() {
            record("-1600");
            assertEquals(GovernorDecision.HALT_DRAWDOWN, governor.evaluate(BALANCE, 15));
            assertTrue(governor.snapshot().alert().contains("drawdown limit reached"));
        }

        @Test
        @DisplayName("exactly at the limit halts, just inside does not")
        void boundary() {
            record("-1400");
            assertEquals(GovernorDecision.ALLOW, governor.evaluate(BALANCE, 15));
            record("100");
            record("-200");
            assertEquals(GovernorDecision.HALT_DRAWDOWN, governor.evaluate(BALANCE, 15));
        }

        @Test
        @DisplayName("non-positive balance: any realised loss halts, flat PnL does not")
        void zeroBalance() {
            assertEquals(GovernorDecision.ALLOW, governor.evaluate(BigDecimal.ZERO, 15));
            record("-0.01");
            assertEquals(GovernorDecision.HALT_DRAWDOWN, governor.evaluate(BigDecimal.ZERO, 15));
        }
    }

    @Test
    @DisplayName("dismissing the alert resets the streak but keeps cumulative PnL")
    void dismissIsAsymmetric() {
        record("-100");
        record("-100");
        record("-100");
        governor.evaluate(BALANCE, 15);

        governor.dismissAlert();

        SafetyState state = governor.snapshot();
        assertNull(state.alert());
        assertEquals(0, state.consecutiveLosses());
        assertEquals(0, new BigDecimal("-300").compareTo(state.cumulativePnl()));
        assertFalse(state.autopilotEnabled());
    }

    @Test
    @DisplayName("rejects a non-positive loss limit")
    void invalidLimit() {
        assertThrows(IllegalArgumentException.class, () -> new RiskGovernor(0));
    }
}
