package bbt.tao.lexroute.resilience;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Классы внешних вызовов с собственными значениями по умолчанию
 * (таймаут, число попыток, порог circuit breaker).
 */
public enum ResiliencePreset {
    GENERATION("generation"),
    RETRIEVAL("retrieval"),
    LEGAL_SEARCH("legal-search"),
    GENERIC_HTTP("generic-http");

    private final String resourceName;

    ResiliencePreset(String resourceName) {
        this.resourceName = resourceName;
    }

    public String resourceName() {
        return resourceName;
    }

    public static Optional<ResiliencePreset> from(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(preset -> preset.resourceName.equals(normalized)
                        || preset.name().toLowerCase(Locale.ROOT).equals(normalized))
                .findFirst();
    }
}
