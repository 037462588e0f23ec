package io.github.vishalmysore.evolution.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Fixed vocabulary of financial event types. Each constant carries the
 * lower snake case code used in datasets and lookup table files.
 */
public enum EventType {
    REGULATORY_PRESSURE("regulatory_pressure"),
    LIQUIDITY_WARNING("liquidity_warning"),
    CREDIT_DOWNGRADE("credit_downgrade"),
    DEBT_DEFAULT("debt_default"),
    MISSED_PAYMENT("missed_payment"),
    STOCK_DECLINE("stock_decline"), // 5-20% drop
    STOCK_CRASH("stock_crash"), // >20% drop
    STOCK_MOVEMENT("stock_movement"),
    TRADING_HALT("trading_halt"),
    CONTAGION("contagion"), // risk spreading to other entities
    REGULATORY_INTERVENTION("regulatory_intervention"),
    GOVERNMENT_INTERVENTION("government_intervention"),
    RESTRUCTURING_ANNOUNCEMENT("restructuring_announcement"),
    DEBT_RESTRUCTURING("debt_restructuring"),
    ASSET_SEIZURE("asset_seizure"),
    BANKRUPTCY("bankruptcy"),
    CAPITAL_RAISING("capital_raising"),
    EARNINGS_ANNOUNCEMENT("earnings_announcement"),
    EARNINGS_WARNING("earnings_warning"),
    EARNINGS_LOSS("earnings_loss"),
    MERGER_ACQUISITION("merger_acquisition"),
    MANAGEMENT_CHANGE("management_change"),
    LEGAL_ISSUE("legal_issue"),
    RESTRUCTURING("restructuring");

    private final String code;

    EventType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Resolves a wire code (case-insensitive, surrounding whitespace ignored).
     * Returns empty for codes outside the vocabulary.
     */
    public static Optional<EventType> fromCode(String code) {
        if (code == null)
            return Optional.empty();
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (EventType type : values()) {
            if (type.code.equals(normalized))
                return Optional.of(type);
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return code;
    }
}
