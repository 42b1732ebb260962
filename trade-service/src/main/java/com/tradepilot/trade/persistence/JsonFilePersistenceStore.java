package com.tradepilot.trade.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tradepilot.common.model.AccountMode;
import com.tradepilot.common.model.RiskConfiguration;
import com.tradepilot.common.model.Trade;
import com.tradepilot.trade.config.EngineProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Stores each part of the engine state in its own JSON file under
 * {@code engine.state-dir}, so a damaged file only resets its own part.
 *
 * <ul>
 *   <li>{@code trades.json}: trade list; records without a mode load as TRIAL and records
 *       without captured exit thresholds take them from the loaded risk configuration</li>
 *   <li>{@code risk.json}: risk configuration; absent fields take the defaults</li>
 *   <li>{@code balances.json}: balance per mode</li>
 *   <li>{@code session.json}: operator session, deleted when the session ends</li>
 * </ul>
 */
@Component
public class JsonFilePersistenceStore implements PersistenceStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFilePersistenceStore.class);

    static final String TRADES_FILE   = "trades.json";
    static final String RISK_FILE     = "risk.json";
    static final String BALANCES_FILE = "balances.json";
    static final String SESSION_FILE  = "session.json";

    private final Path directory;
    private final ObjectMapper objectMapper;
    private final EngineProperties properties;

    public JsonFilePersistenceStore(EngineProperties properties, ObjectMapper objectMapper) {
        this.directory    = Path.of(properties.getStateDir());
        this.objectMapper = objectMapper;
        this.properties   = properties;
    }

    @Override
    public EngineSnapshot load() {
        RiskConfiguration risk = loadRisk();
        Map<AccountMode, BigDecimal> balances = loadBalances();
        EngineSnapshot snapshot = new EngineSnapshot(
            loadTrades(risk), risk, balances.get(AccountMode.TRIAL), balances.get(AccountMode.LIVE), loadSession());
        log.info("[Persistence] State loaded. dir={} trades={} trialBalance={} liveBalance={} session={}",
                 directory, snapshot.getTrades().size(), snapshot.getTrialBalance(), snapshot.getLiveBalance(),
                 snapshot.getSession() != null);
        return snapshot;
    }

    @Override
    public void save(EngineSnapshot snapshot) {
        Map<AccountMode, BigDecimal> balances = new EnumMap<>(AccountMode.class);
        balances.put(AccountMode.TRIAL, snapshot.getTrialBalance());
        balances.put(AccountMode.LIVE, snapshot.getLiveBalance());

        write(TRADES_FILE, snapshot.getTrades());
        write(RISK_FILE, snapshot.getRiskConfiguration());
        write(BALANCES_FILE, balances);
        if (snapshot.getSession() != null) {
            write(SESSION_FILE, snapshot.getSession());
        } else {
            delete(SESSION_FILE);
        }
    }

    // ── loading ───────────────────────────────────────────────────────────────

    private RiskConfiguration loadRisk() {
        RiskConfiguration defaults = RiskConfiguration.defaults();
        JsonNode stored = readTree(RISK_FILE);
        if (stored == null || !stored.isObject()) {
            return defaults;
        }
        try {
            ObjectNode merged = objectMapper.valueToTree(defaults);
            Iterator<Map.Entry<String, JsonNode>> fields = stored.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (merged.has(field.getKey()) && !field.getValue().isNull()) {
                    merged.set(field.getKey(), field.getValue());
                }
            }
            return objectMapper.treeToValue(merged, RiskConfiguration.class).validate();
        } catch (Exception e) {
            log.warn("[Persistence] Risk configuration unusable, using defaults. reason={}", e.getMessage());
            return defaults;
        }
    }

    private List<Trade> loadTrades(RiskConfiguration risk) {
        JsonNode stored = readTree(TRADES_FILE);
        if (stored == null) {
            return new ArrayList<>();
        }
        if (!stored.isArray()) {
            log.warn("[Persistence] Trade list is not an array, starting empty. file={}", TRADES_FILE);
            return new ArrayList<>();
        }
        List<Trade> trades = new ArrayList<>();
        try {
            for (JsonNode node : stored) {
                Trade trade = objectMapper.treeToValue(node, Trade.class);
                if (trade.id() == null || trade.pair() == null || trade.side() == null
                        || trade.entryPrice() == null || trade.amount() == null || trade.status() == null) {
                    throw new IllegalArgumentException("incomplete trade record " + node);
                }
                if (trade.accountMode() == null) {
                    trade = trade.withAccountMode(AccountMode.TRIAL);
                }
                if (!node.has("stopLossPct") || !node.has("takeProfitPct")) {
                    trade = new Trade(trade.id(), trade.pair(), trade.side(), trade.entryPrice(), trade.exitPrice(),
                        trade.amount(), trade.status(), trade.pnl(), trade.openedAt(), trade.stopLossPrice(),
                        trade.takeProfitPrice(), risk.stopLossPct(), risk.takeProfitPct(), trade.accountMode());
                }
                trades.add(trade);
            }
        } catch (Exception e) {
            log.warn("[Persistence] Trade list unreadable, starting empty. reason={}", e.getMessage());
            return new ArrayList<>();
        }
        return trades;
    }

    private Map<AccountMode, BigDecimal> loadBalances() {
        Map<AccountMode, BigDecimal> balances = new EnumMap<>(AccountMode.class);
        balances.put(AccountMode.TRIAL, properties.getInitialTrialBalance());
        balances.put(AccountMode.LIVE, properties.getInitialLiveBalance());

        JsonNode stored = readTree(BALANCES_FILE);
        if (stored == null) {
            return balances;
        }
        try {
            Map<AccountMode, BigDecimal> parsed = objectMapper.convertValue(stored,
                new TypeReference<Map<AccountMode, BigDecimal>>() {});
            parsed.forEach((mode, value) -> {
                if (mode != null && value != null) {
                    balances.put(mode, value);
                }
            });
        } catch (IllegalArgumentException e) {
            log.warn("[Persistence] Balances unreadable, using initial balances. reason={}", e.getMessage());
        }
        return balances;
    }

    private OperatorSession loadSession() {
        JsonNode stored = readTree(SESSION_FILE);
        if (stored == null || !stored.isObject()) {
            return null;
        }
        try {
            return objectMapper.treeToValue(stored, OperatorSession.class);
        } catch (Exception e) {
            log.warn("[Persistence] Session unreadable, ignoring it. reason={}", e.getMessage());
            return null;
        }
    }

    private JsonNode readTree(String fileName) {
        Path file = directory.resolve(fileName);
        if (!Files.exists(file)) {
            return null;
        }
        try {
            return objectMapper.readTree(file.toFile());
        } catch (IOException e) {
            log.warn("[Persistence] Unreadable state file, falling back to defaults. file={} reason={}",
                     file, e.getMessage());
            return null;
        }
    }

    // ── writing ───────────────────────────────────────────────────────────────

    private void write(String fileName, Object value) {
        Path target = directory.resolve(fileName);
        try {
            Files.createDirectories(directory);
            Path temp = directory.resolve(fileName + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), value);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            log.warn("[Persistence] Failed to write state file. file={} reason={}", target, e.getMessage());
        }
    }

    private void delete(String fileName) {
        try {
            Files.deleteIfExists(directory.resolve(fileName));
        } catch (IOException e) {
            log.warn("[Persistence] Failed to delete state file. file={} reason={}", fileName, e.getMessage());
        }
    }
}
