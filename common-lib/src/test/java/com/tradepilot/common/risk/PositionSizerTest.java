package com.tradepilot.common.risk;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class PositionSizerTest {

    private static final BigDecimal PRICE = new BigDecimal("96450");

    @Test
    @DisplayName("risk fraction below cap → balance × fraction")
    void fractionBinds() {
        BigDecimal size = PositionSizer.safeSize(new BigDecimal("1000"), PRICE, 0.02, new BigDecimal("50"));
        assertEquals(0, size.compareTo(new BigDecimal("20")));
    }

    @Test
    @DisplayName("cap binds when balance × fraction exceeds it")
    void capBinds() {
        BigDecimal size = PositionSizer.safeSize(new BigDecimal("10000"), PRICE, 0.02, new BigDecimal("50"));
        assertEquals(0, size.compareTo(new BigDecimal("50")));
    }

    @Test
    @DisplayName("never exceeds balance even with fraction above 1")
    void neverExceedsBalance() {
        BigDecimal size = PositionSizer.safeSize(new BigDecimal("30"), PRICE, 2.0, new BigDecimal("500"));
        assertEquals(0, size.compareTo(new BigDecimal("30")));
    }

    @Test
    @DisplayName("non-positive balance, fraction or cap → zero")
    void degenerateInputs() {
        assertEquals(0, PositionSizer.safeSize(new BigDecimal("-5"), PRICE, 0.02, BigDecimal.TEN).signum());
        assertEquals(0, PositionSizer.safeSize(BigDecimal.ZERO, PRICE, 0.02, BigDecimal.TEN).signum());
        assertEquals(0, PositionSizer.safeSize(new BigDecimal("100"), PRICE, 0.0, BigDecimal.TEN).signum());
        assertEquals(0, PositionSizer.safeSize(new BigDecimal("100"), PRICE, Double.NaN, BigDecimal.TEN).signum());
        assertEquals(0, PositionSizer.safeSize(new BigDecimal("100"), PRICE, 0.02, BigDecimal.ZERO).signum());
    }

    @Test
    @DisplayName("result always inside [0, min(balance × r, cap)]")
    void boundsHold() {
        double[] fractions = {0.0001, 0.013, 0.02, 0.333, 0.5, 1.0};
        String[] balances = {"0.01", "12.34", "999.99", "10000", "2450.75"};
        String[] caps = {"0.5", "10", "50", "100000"};
        for (String b : balances) {
            for (double r : fractions) {
                for (String c : caps) {
                    BigDecimal balance = new BigDecimal(b);
                    BigDecimal cap = new BigDecimal(c);
                    BigDecimal size = PositionSizer.safeSize(balance, PRICE, r, cap);
                    BigDecimal upper = balance.multiply(BigDecimal.valueOf(r)).min(cap);
                    assertTrue(size.signum() >= 0, "negative size for " + b + "/" + r + "/" + c);
                    assertTrue(size.compareTo(upper) <= 0, "size " + size + " exceeds " + upper);
                    assertTrue(size.compareTo(balance) <= 0, "size exceeds balance " + b);
                }
            }
        }
    }

    @Test
    @DisplayName("independent of price")
    void priceIndependent() {
        BigDecimal a = PositionSizer.safeSize(new BigDecimal("5000"), new BigDecimal("1"), 0.02, new BigDecimal("500"));
        BigDecimal b = PositionSizer.safeSize(new BigDecimal("5000"), new BigDecimal("98000"), 0.02, new BigDecimal("500"));
        assertEquals(a, b);
    }

    @Test
    @DisplayName("units converts notional at price")
    void units() {
        BigDecimal units = PositionSizer.units(new BigDecimal("100"), new BigDecimal("50"));
        assertEquals(0, units.compareTo(new BigDecimal("2")));
        assertEquals(0, PositionSizer.units(new BigDecimal("100"), BigDecimal.ZERO).signum());
    }
}
