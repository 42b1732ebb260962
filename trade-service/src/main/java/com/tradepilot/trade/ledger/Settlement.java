package com.tradepilot.trade.ledger;

import com.tradepilot.common.model.Trade;

import java.math.BigDecimal;

/**
 * Result of closing a trade.
 *
 * @param trade        the CLOSED trade
 * @param pnlPercent   signed move from entry, in percent
 * @param pnlValue     realised money PnL
 * @param balanceAfter balance of the trade's account after the credit
 * @param manual       true when the operator closed it, false when an exit level triggered
 */
public record Settlement(
    Trade trade,
    BigDecimal pnlPercent,
    BigDecimal pnlValue,
    BigDecimal balanceAfter,
    boolean manual
) {}
