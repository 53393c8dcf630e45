package bbt.tao.lexroute.service;

import bbt.tao.lexroute.cache.CacheKeys;
import bbt.tao.lexroute.cache.QueryCache;
import bbt.tao.lexroute.classifier.Classification;
import bbt.tao.lexroute.classifier.QueryClassifier;
import bbt.tao.lexroute.classifier.QueryIntent;
import bbt.tao.lexroute.dto.api.AnswerMetadata;
import bbt.tao.lexroute.dto.api.QueryAnswer;
import bbt.tao.lexroute.dto.api.QueryOptions;
import bbt.tao.lexroute.resilience.ResilienceMiddleware;
import bbt.tao.lexroute.resilience.ResiliencePolicies;
import bbt.tao.lexroute.service.context.AggregatedContext;
import bbt.tao.lexroute.service.context.ContextAggregator;
import bbt.tao.lexroute.service.context.PromptAssembler;
import bbt.tao.lexroute.service.intent.DirectFullTextHandler;
import bbt.tao.lexroute.service.intent.DocumentDeletionHandler;
import bbt.tao.lexroute.service.intent.DocumentSweepHandler;
import bbt.tao.lexroute.service.llm.ChatTurn;
import bbt.tao.lexroute.service.llm.GenerationBackend;
import bbt.tao.lexroute.service.llm.GenerationBackendRegistry;
import bbt.tao.lexroute.service.llm.GenerationResult;
import bbt.tao.lexroute.service.rag.DocumentService;
import bbt.tao.lexroute.service.rag.StoredDocumentInfo;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Маршрутизатор запросов: классификация, особые намерения, сбор контекста, генерация.
 * Запросы независимы друг от друга, состояние между ними не хранится.
 */
@Slf4j
public class QueryRouterService {

    static final double TEMPERATURE = 0.7;
    static final String ERROR_PREFIX = "Помилка при обробці запиту: ";
    static final String STREAM_ERROR_PREFIX = "Помилка: ";

    private final QueryClassifier classifier;
    private final DocumentService documents;
    private final ContextAggregator aggregator;
    private final PromptAssembler prompts;
    private final GenerationBackendRegistry backends;
    private final ResilienceMiddleware middleware;
    private final ResiliencePolicies policies;
    private final QueryCache cache;
    private final DirectFullTextHandler fullTextHandler;
    private final DocumentSweepHandler sweepHandler;
    private final DocumentDeletionHandler deletionHandler;

    public QueryRouterService(QueryClassifier classifier,
                              DocumentService documents,
                              ContextAggregator aggregator,
                              PromptAssembler prompts,
                              GenerationBackendRegistry backends,
                              ResilienceMiddleware middleware,
                              ResiliencePolicies policies,
                              QueryCache cache,
                              DirectFullTextHandler fullTextHandler,
                              DocumentSweepHandler sweepHandler,
                              DocumentDeletionHandler deletionHandler) {
        this.classifier = classifier;
        this.documents = documents;
        this.aggregator = aggregator;
        this.prompts = prompts;
        this.backends = backends;
        this.middleware = middleware;
        this.policies = policies;
        this.cache = cache;
        this.fullTextHandler = fullTextHandler;
        this.sweepHandler = sweepHandler;
        this.deletionHandler = deletionHandler;
    }

    public Mono<QueryAnswer> answer(String query, QueryOptions options) {
        String normalized = normalize(query);
        QueryOptions effective = options == null ? QueryOptions.defaults() : options;
        return prepare(normalized, effective)
                .flatMap(plan -> plan.shortCircuit() != null
                        ? Mono.just(plan.shortCircuit())
                        : generate(normalized, plan, effective));
    }

    public Flux<String> answerStream(String query, QueryOptions options) {
        String normalized = normalize(query);
        QueryOptions effective = options == null ? QueryOptions.defaults() : options;
        return prepare(normalized, effective)
                .flatMapMany(plan -> {
                    if (plan.shortCircuit() != null) {
                        return Flux.just(plan.shortCircuit().getAnswer());
                    }
                    GenerationBackend backend = backends.resolve(effective.getProvider(), effective.getModel());
                    List<ChatTurn> messages = prompts.assemble(normalized, plan.context());
                    return middleware.callStream(policies.generation(),
                            () -> backend.streamGenerate(messages, TEMPERATURE, null));
                })
                .onErrorResume(e -> {
                    log.error("Ошибка потоковой генерации: {}", e.toString());
                    return Flux.just(STREAM_ERROR_PREFIX + e.getMessage());
                });
    }

    private Mono<Plan> prepare(String query, QueryOptions options) {
        return classifier.classify(query)
                .map(classification -> applyOverrides(classification, options))
                .doOnNext(c -> log.info("Маршрут: rag={}, law={}, intent={}, case={}",
                        c.useRetrieval(), c.useLegal(), c.intent(), c.caseNumber()))
                .flatMap(classification -> {
                    if (classification.intent() == QueryIntent.FULL_TEXT_BY_CASE_NUMBER
                            && classification.caseNumber() != null
                            && options.isDirectFullText()) {
                        return fullTextHandler.handle(classification.caseNumber()).map(Plan::ready);
                    }
                    return inventory().flatMap(inventory -> route(query, classification, inventory, options));
                });
    }

    private Mono<Plan> route(String query, Classification classification, Inventory inventory, QueryOptions options) {
        return switch (classification.intent()) {
            case DELETE_ALL_DOCUMENTS -> deletionHandler.deleteAll(inventory.documents()).map(Plan::ready);
            case DELETE_DOCUMENT -> deletionHandler.deleteOne(query, inventory.documents(), classification.documentNumber())
                    .map(Plan::ready);
            case DOCUMENT_SWEEP -> inventory.documents().isEmpty()
                    ? collect(query, classification, inventory, options)
                    : sweepHandler.sweep(query, inventory.documents(), classification, options).map(Plan::ready);
            default -> collect(query, classification, inventory, options);
        };
    }

    private Mono<Plan> collect(String query, Classification classification, Inventory inventory, QueryOptions options) {
        return aggregator.aggregate(query, classification, inventory.documents(), options)
                .map(context -> new Plan(classification, context.withErrors(inventory.errors()), null));
    }

    private Mono<Inventory> inventory() {
        return documents.listDocuments()
                .map(list -> new Inventory(list, List.of()))
                .onErrorResume(e -> {
                    log.warn("Список документов недоступен: {}", e.toString());
                    return Mono.just(new Inventory(List.of(), List.of("Documents summary error: " + e.getMessage())));
                });
    }

    private Mono<QueryAnswer> generate(String query, Plan plan, QueryOptions options) {
        Classification classification = plan.classification();
        AggregatedContext context = plan.context();
        GenerationBackend backend = backends.resolve(options.getProvider(), options.getModel());
        String key = CacheKeys.answer(query, backend.provider(), backend.model(),
                classification.useRetrieval(), classification.useLegal(), context.fingerprint());

        return cache.answer(key)
                .map(hit -> {
                    log.debug("Ответ из кэша для '{}'", query);
                    hit.setMetadata(hit.getMetadata() == null
                            ? metadata(classification, context, List.of()).toBuilder().cached(true).build()
                            : hit.getMetadata().toBuilder().cached(true).build());
                    return hit;
                })
                .switchIfEmpty(Mono.defer(() -> middleware.call(policies.generation(),
                                () -> backend.generate(prompts.assemble(query, context), TEMPERATURE, null))
                        .map(result -> success(result, classification, context))
                        .flatMap(answer -> cache.putAnswer(key, answer).thenReturn(answer))
                        .onErrorResume(e -> {
                            log.error("Ошибка генерации ответа: {}", e.toString());
                            return Mono.just(failure(e, classification, context));
                        })));
    }

    private static QueryAnswer success(GenerationResult result, Classification classification, AggregatedContext context) {
        return QueryAnswer.builder()
                .answer(result.content())
                .sources(new ArrayList<>(context.sources()))
                .model(result.model())
                .usage(result.usage())
                .metadata(metadata(classification, context, List.of()))
                .build();
    }

    private static QueryAnswer failure(Throwable error, Classification classification, AggregatedContext context) {
        String message = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        return QueryAnswer.builder()
                .answer(ERROR_PREFIX + message)
                .sources(new ArrayList<>(context.sources()))
                .error(message)
                .metadata(metadata(classification, context, List.of("LLM error: " + message)))
                .build();
    }

    private static AnswerMetadata metadata(Classification classification, AggregatedContext context, List<String> extraErrors) {
        List<String> errors = new ArrayList<>(context.errors());
        errors.addAll(extraErrors);
        return AnswerMetadata.builder()
                .usedRetrieval(classification.useRetrieval())
                .usedLegal(classification.useLegal())
                .intent(classification.intent().name())
                .contextCount(context.fragments().size())
                .errors(errors)
                .cached(false)
                .build();
    }

    static Classification applyOverrides(Classification classification, QueryOptions options) {
        boolean retrieval = options.getUseRetrieval() != null ? options.getUseRetrieval() : classification.useRetrieval();
        boolean legal = options.getUseLegal() != null ? options.getUseLegal() : classification.useLegal();
        if (retrieval == classification.useRetrieval() && legal == classification.useLegal()) {
            return classification;
        }
        return classification.withSources(retrieval, legal);
    }

    private static String normalize(String query) {
        return query == null ? "" : query.trim();
    }

    private record Inventory(List<StoredDocumentInfo> documents, List<String> errors) {
    }

    private record Plan(Classification classification, AggregatedContext context, QueryAnswer shortCircuit) {

        static Plan ready(QueryAnswer answer) {
            return new Plan(null, AggregatedContext.empty(), answer);
        }
    }
}
