package io.github.vishalmysore.evolution.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Topic taxonomy used by the topic relevance scorer.
 */
public enum TopicCategory {
    CREDIT,
    MARKET,
    REGULATORY,
    CORPORATE,
    SYSTEMIC,
    LIQUIDITY,
    EARNINGS,
    LEGAL;

    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<TopicCategory> fromCode(String code) {
        if (code == null || code.isBlank())
            return Optional.empty();
        try {
            return Optional.of(valueOf(code.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
