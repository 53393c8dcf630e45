package bbt.tao.lexroute.classifier;

import bbt.tao.lexroute.cache.QueryCache;
import bbt.tao.lexroute.resilience.ResilienceMiddleware;
import bbt.tao.lexroute.resilience.ResiliencePolicies;
import bbt.tao.lexroute.service.llm.ChatTurn;
import bbt.tao.lexroute.service.llm.GenerationBackendRegistry;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Извлечение номера дела вида {@code 123/456/78}. Сначала регулярное выражение,
 * затем LLM, которой разрешено ответить только номером или словом {@code none}.
 * Ответ LLM проверяется тем же шаблоном, так что выдумать номер она не может.
 */
@Slf4j
public class CaseNumberExtractor {

    public static final Pattern CASE_NUMBER = Pattern.compile("\\d+/\\d+/\\d+");

    private static final String NONE = "none";
    private static final String SYSTEM_PROMPT = """
            Ти витягуєш номер судової справи з тексту користувача.
            Номер справи має формат цифри/цифри/цифри, наприклад 756/655/23.
            Відповідай ТІЛЬКИ номером справи або словом none, без пояснень.
            """;

    private final GenerationBackendRegistry backends;
    private final ResilienceMiddleware middleware;
    private final ResiliencePolicies policies;
    private final QueryCache cache;

    public CaseNumberExtractor(GenerationBackendRegistry backends,
                               ResilienceMiddleware middleware,
                               ResiliencePolicies policies,
                               QueryCache cache) {
        this.backends = backends;
        this.middleware = middleware;
        this.policies = policies;
        this.cache = cache;
    }

    public static Optional<String> findByPattern(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = CASE_NUMBER.matcher(text);
        return matcher.find() ? Optional.of(matcher.group()) : Optional.empty();
    }

    /**
     * @return номер дела; пустой {@link Mono}, если его нет. Ошибки LLM не пробрасываются.
     */
    public Mono<String> extract(String query) {
        Optional<String> byPattern = findByPattern(query);
        if (byPattern.isPresent()) {
            return Mono.just(byPattern.get());
        }
        if (query == null || query.isBlank()) {
            return Mono.empty();
        }
        return cache.caseNumber(query)
                .switchIfEmpty(Mono.defer(() -> askModel(query)
                        .flatMap(found -> cache.putCaseNumber(query, found).thenReturn(found))))
                .filter(found -> !found.isEmpty());
    }

    private Mono<String> askModel(String query) {
        List<ChatTurn> messages = List.of(ChatTurn.system(SYSTEM_PROMPT), ChatTurn.user(query));
        return middleware.call(policies.generation(),
                        () -> backends.defaultBackend().generate(messages, 0.0, 20))
                .map(result -> result.content() == null ? "" : result.content().trim())
                .map(answer -> {
                    if (answer.equalsIgnoreCase(NONE)) {
                        return "";
                    }
                    return findByPattern(answer).orElse("");
                })
                .doOnNext(found -> log.debug("LLM номер дела для '{}': '{}'", query, found))
                .onErrorResume(e -> {
                    log.warn("LLM извлечение номера дела не удалось: {}", e.toString());
                    return Mono.empty();
                });
    }
}
