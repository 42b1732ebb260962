package com.tradepilot.trade.persistence;

import com.tradepilot.common.model.RiskConfiguration;
import com.tradepilot.common.model.Trade;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Everything the engine persists between runs. Trades are stored newest first;
 * {@code session} is null when no operator is signed in.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EngineSnapshot {

    private List<Trade> trades = new ArrayList<>();
    private RiskConfiguration riskConfiguration = RiskConfiguration.defaults();
    private BigDecimal trialBalance;
    private BigDecimal liveBalance;
    private OperatorSession session;
}
