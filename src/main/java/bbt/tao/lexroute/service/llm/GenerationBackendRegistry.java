package bbt.tao.lexroute.service.llm;

import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.Map;

/**
 * Выбор генерирующего бэкенда по провайдеру и модели из параметров запроса.
 * Неизвестный провайдер заменяется провайдером по умолчанию.
 */
@Slf4j
public class GenerationBackendRegistry {

    private final Map<LlmProvider, SpringAiGenerationBackend> backends;
    private final LlmProvider defaultProvider;

    public GenerationBackendRegistry(Map<LlmProvider, SpringAiGenerationBackend> backends, LlmProvider defaultProvider) {
        if (backends.isEmpty()) {
            throw new IllegalArgumentException("No generation providers configured");
        }
        this.backends = new EnumMap<>(backends);
        this.defaultProvider = this.backends.containsKey(defaultProvider)
                ? defaultProvider
                : this.backends.keySet().iterator().next();
        if (this.defaultProvider != defaultProvider) {
            log.warn("Провайдер по умолчанию '{}' не настроен, используется '{}'", defaultProvider.id(), this.defaultProvider.id());
        }
    }

    public GenerationBackend resolve(String provider, String model) {
        LlmProvider requested = LlmProvider.from(provider).orElse(defaultProvider);
        SpringAiGenerationBackend backend = backends.get(requested);
        if (backend == null) {
            log.warn("Провайдер '{}' не настроен, используется '{}'", provider, defaultProvider.id());
            backend = backends.get(defaultProvider);
        }
        return backend.withModel(model);
    }

    public GenerationBackend defaultBackend() {
        return backends.get(defaultProvider);
    }
}
