package bbt.tao.lexroute.service.llm;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * OpenAI-совместимые генерирующие бэкенды.
 */
public enum LlmProvider {
    OPENAI("openai"),
    LMSTUDIO("lmstudio"),
    CUSTOM("custom");

    private final String id;

    LlmProvider(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static Optional<LlmProvider> from(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(provider -> provider.id.equals(normalized))
                .findFirst();
    }
}
