package com.tradepilot.trade.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Engine tunables bound from {@code engine.*}. Defaults mirror the values the
 * engine was calibrated with and are used as-is when nothing is configured.
 */
@Configuration
@ConfigurationProperties(prefix = "engine")
@Data
public class EngineProperties {

    private List<String> pairs = new ArrayList<>(List.of("BTC/USDT", "ETH/USDT", "SOL/USDT"));

    private Duration autopilotInterval  = Duration.ofSeconds(10);
    private Duration settlementInterval = Duration.ofSeconds(5);
    private Duration feedInterval       = Duration.ofSeconds(8);
    private Duration feedTimeout        = Duration.ofSeconds(4);
    private Duration advisoryTimeout    = Duration.ofMillis(6500);

    private int minAutopilotHistory = 50;
    private int minAdvisoryHistory  = 20;
    private int maxConsecutiveLosses = 3;
    private int historyCapacity = 101;
    private int eventCapacity   = 50;

    private BigDecimal minNotional         = BigDecimal.TEN;
    private BigDecimal initialTrialBalance = new BigDecimal("10000.00");
    private BigDecimal initialLiveBalance  = new BigDecimal("2450.75");

    /** Directory holding the persisted state files. */
    private String stateDir = "./data";

    /** Start the periodic tasks when the application context is ready. */
    private boolean autoStart = true;
}
