package bbt.tao.lexroute.classifier;

import bbt.tao.lexroute.cache.QueryCache;
import bbt.tao.lexroute.exception.MalformedResponseException;
import bbt.tao.lexroute.resilience.ResilienceMiddleware;
import bbt.tao.lexroute.resilience.ResiliencePolicies;
import bbt.tao.lexroute.service.llm.ChatTurn;
import bbt.tao.lexroute.service.llm.GenerationBackendRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Классификация запроса: кэш, затем LLM с JSON-ответом, при любой ошибке правила
 * {@link RuleBasedClassifier}. Результат кэшируется независимо от того, какой путь его дал.
 * Возвращаемый {@link Mono} никогда не завершается ошибкой.
 */
@Slf4j
public class QueryClassifier {

    private static final Pattern JSON_OBJECT = Pattern.compile("\\{[\\s\\S]*}");
    private static final int MAX_TOKENS = 200;
    private static final double TEMPERATURE = 0.1;

    private static final String SYSTEM_PROMPT = """
            Ти класифікуєш запити користувача юридичного асистента.
            Поверни ТІЛЬКИ один JSON об'єкт без пояснень:
            {"use_law": bool, "use_rag": bool, "query_type": string, "has_case_number": bool, "is_document_text_query": bool}
            use_law: потрібна судова практика або законодавство.
            use_rag: потрібні завантажені користувачем документи.
            query_type: одне з general, list_documents, document_sweep, delete_all_documents, delete_document, full_text.
            has_case_number: у запиті є номер справи у форматі цифри/цифри/цифри.
            is_document_text_query: користувач просить повний текст судового рішення.
            """;

    private final GenerationBackendRegistry backends;
    private final ResilienceMiddleware middleware;
    private final ResiliencePolicies policies;
    private final QueryCache cache;
    private final RuleBasedClassifier rules;
    private final CaseNumberExtractor caseNumbers;
    private final ObjectMapper objectMapper;

    public QueryClassifier(GenerationBackendRegistry backends,
                           ResilienceMiddleware middleware,
                           ResiliencePolicies policies,
                           QueryCache cache,
                           RuleBasedClassifier rules,
                           CaseNumberExtractor caseNumbers,
                           ObjectMapper objectMapper) {
        this.backends = backends;
        this.middleware = middleware;
        this.policies = policies;
        this.cache = cache;
        this.rules = rules;
        this.caseNumbers = caseNumbers;
        this.objectMapper = objectMapper;
    }

    public Mono<Classification> classify(String query) {
        String normalized = query == null ? "" : query.trim();
        if (normalized.isEmpty()) {
            return Mono.just(Classification.bothSources());
        }
        return cache.classification(normalized)
                .doOnNext(hit -> log.debug("Классификация из кэша: {}", hit))
                .switchIfEmpty(Mono.defer(() -> classifyFresh(normalized)
                        .flatMap(result -> cache.putClassification(normalized, result).thenReturn(result))));
    }

    private Mono<Classification> classifyFresh(String query) {
        List<ChatTurn> messages = List.of(ChatTurn.system(SYSTEM_PROMPT), ChatTurn.user(query));
        return middleware.call(policies.generation(),
                        () -> backends.defaultBackend().generate(messages, TEMPERATURE, MAX_TOKENS))
                .map(result -> parse(result.content()))
                .flatMap(verdict -> resolve(verdict, query))
                .doOnNext(result -> log.info("Классификация LLM: rag={}, law={}, intent={}, case={}",
                        result.useRetrieval(), result.useLegal(), result.intent(), result.caseNumber()))
                .onErrorResume(e -> {
                    Classification fallback = rules.classify(query);
                    log.warn("Классификация LLM не удалась ({}), используем правила: rag={}, law={}, intent={}",
                            e.toString(), fallback.useRetrieval(), fallback.useLegal(), fallback.intent());
                    return Mono.just(fallback);
                });
    }

    LlmVerdict parse(String content) {
        if (content == null || content.isBlank()) {
            throw new MalformedResponseException("Пустой ответ классификатора");
        }
        log.debug("Сырой ответ классификатора: {}", content);
        Matcher matcher = JSON_OBJECT.matcher(content);
        if (!matcher.find()) {
            throw new MalformedResponseException("В ответе классификатора нет JSON: " + abbreviate(content));
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(matcher.group());
        } catch (Exception e) {
            throw new MalformedResponseException("Невалидный JSON классификатора: " + abbreviate(content), e);
        }
        if (!node.has("use_law") || !node.has("use_rag")) {
            throw new MalformedResponseException("В JSON классификатора нет use_law/use_rag: " + abbreviate(content));
        }
        return new LlmVerdict(
                node.path("use_rag").asBoolean(false),
                node.path("use_law").asBoolean(false),
                node.path("query_type").asText("general"),
                node.path("has_case_number").asBoolean(false),
                node.path("is_document_text_query").asBoolean(false));
    }

    private Mono<Classification> resolve(LlmVerdict verdict, String query) {
        Integer documentNumber = rules.extractDocumentNumber(query).orElse(null);
        QueryIntent intent = toIntent(verdict.queryType());
        if (intent != QueryIntent.GENERAL && intent != QueryIntent.FULL_TEXT_BY_CASE_NUMBER) {
            return Mono.just(new Classification(true, false, intent, false, null, documentNumber, false));
        }
        boolean fullText = intent == QueryIntent.FULL_TEXT_BY_CASE_NUMBER
                || verdict.documentTextQuery()
                || rules.isFullTextRequest(query);

        Mono<String> caseNumber = verdict.hasCaseNumber() || CaseNumberExtractor.findByPattern(query).isPresent()
                ? caseNumbers.extract(query)
                : Mono.empty();

        return caseNumber
                .map(number -> new Classification(
                        verdict.useRetrieval() && !fullText,
                        true,
                        fullText ? QueryIntent.FULL_TEXT_BY_CASE_NUMBER : QueryIntent.GENERAL,
                        true, number, documentNumber, fullText))
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    boolean retrieval = verdict.useRetrieval();
                    boolean legal = verdict.useLegal();
                    if (!retrieval && !legal) {
                        retrieval = true;
                        legal = true;
                    }
                    return new Classification(retrieval, legal, QueryIntent.GENERAL, false, null, documentNumber, false);
                }));
    }

    private static QueryIntent toIntent(String queryType) {
        return switch (queryType == null ? "" : queryType.trim().toLowerCase(Locale.ROOT)) {
            case "list_documents" -> QueryIntent.LIST_DOCUMENTS;
            case "document_sweep" -> QueryIntent.DOCUMENT_SWEEP;
            case "delete_all_documents" -> QueryIntent.DELETE_ALL_DOCUMENTS;
            case "delete_document" -> QueryIntent.DELETE_DOCUMENT;
            case "full_text" -> QueryIntent.FULL_TEXT_BY_CASE_NUMBER;
            default -> QueryIntent.GENERAL;
        };
    }

    private static String abbreviate(String content) {
        return content.length() <= 120 ? content : content.substring(0, 120) + "...";
    }

    record LlmVerdict(boolean useRetrieval, boolean useLegal, String queryType,
                      boolean hasCaseNumber, boolean documentTextQuery) {
    }
}
