package bbt.tao.lexroute.service.intent;

import bbt.tao.lexroute.classifier.Classification;
import bbt.tao.lexroute.classifier.QueryIntent;
import bbt.tao.lexroute.dto.api.AnswerMetadata;
import bbt.tao.lexroute.dto.api.QueryAnswer;
import bbt.tao.lexroute.dto.api.QueryOptions;
import bbt.tao.lexroute.resilience.ResilienceMiddleware;
import bbt.tao.lexroute.resilience.ResiliencePolicies;
import bbt.tao.lexroute.service.context.ContextFragment;
import bbt.tao.lexroute.service.context.PromptAssembler;
import bbt.tao.lexroute.service.llm.GenerationBackend;
import bbt.tao.lexroute.service.llm.GenerationBackendRegistry;
import bbt.tao.lexroute.service.llm.GenerationResult;
import bbt.tao.lexroute.service.llm.TokenUsage;
import bbt.tao.lexroute.service.rag.DocumentChunk;
import bbt.tao.lexroute.service.rag.RetrievalBackend;
import bbt.tao.lexroute.service.rag.StoredDocumentInfo;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Поиск ответа по каждому документу отдельно, строго по очереди.
 * Первый документ с содержательным ответом останавливает перебор, остальные не запрашиваются.
 */
@Slf4j
public class DocumentSweepHandler {

    static final String NOT_FOUND_MARKER = "NOT_FOUND";
    static final String NOTHING_FOUND = "У ваших документах не знайдено відповіді на це питання.";

    private static final List<String> NEGATIVE_PHRASES = List.of(
            "не знайдено", "немає інформації", "не містить", "відсутня інформація", "інформація відсутня",
            "не найдено", "нет информации", "не содержит", "not found");

    private static final double TEMPERATURE = 0.3;

    private final RetrievalBackend retrieval;
    private final GenerationBackendRegistry backends;
    private final ResilienceMiddleware middleware;
    private final ResiliencePolicies policies;
    private final PromptAssembler prompts;

    public DocumentSweepHandler(RetrievalBackend retrieval,
                                GenerationBackendRegistry backends,
                                ResilienceMiddleware middleware,
                                ResiliencePolicies policies,
                                PromptAssembler prompts) {
        this.retrieval = retrieval;
        this.backends = backends;
        this.middleware = middleware;
        this.policies = policies;
        this.prompts = prompts;
    }

    public Mono<QueryAnswer> sweep(String query,
                                   List<StoredDocumentInfo> documents,
                                   Classification classification,
                                   QueryOptions options) {
        List<StoredDocumentInfo> targets = targets(documents, classification);
        GenerationBackend backend = backends.resolve(options.getProvider(), options.getModel());
        List<String> errors = new CopyOnWriteArrayList<>();
        log.info("Перебор документов: {} шт., запрос '{}'", targets.size(), query);

        return Flux.fromIterable(targets)
                .concatMap(doc -> Mono.defer(() -> ask(query, doc, backend))
                        .onErrorResume(e -> {
                            log.warn("Документ '{}' пропущен при переборе: {}", doc.name(), e.toString());
                            errors.add("Sweep error (" + doc.name() + "): " + e.getMessage());
                            return Mono.empty();
                        }))
                .filter(hit -> !isNegative(hit.result().content()))
                .next()
                .map(hit -> {
                    log.info("Ответ найден в документе '{}'", hit.document().name());
                    return answer("Документ «" + hit.document().name() + "»:\n\n" + hit.result().content().trim(),
                            hit.result().model(), hit.result().usage(), errors, true);
                })
                .switchIfEmpty(Mono.fromSupplier(() -> answer(NOTHING_FOUND, backend.model(), TokenUsage.EMPTY, errors, false)));
    }

    private Mono<Hit> ask(String query, StoredDocumentInfo doc, GenerationBackend backend) {
        log.debug("Перебор: запрос к документу '{}'", doc.name());
        return middleware.offload(policies.retrieval(), () -> retrieval.getDocumentChunks(doc.name()))
                .map(chunks -> chunks.stream().map(DocumentChunk::text).collect(Collectors.joining("\n")))
                .filter(text -> !text.isBlank())
                .flatMap(text -> middleware.call(policies.generation(),
                        () -> backend.generate(prompts.assembleForDocument(query, doc.name(), text), TEMPERATURE, null)))
                .map(result -> new Hit(doc, result));
    }

    static List<StoredDocumentInfo> targets(List<StoredDocumentInfo> documents, Classification classification) {
        Integer number = classification.documentNumber();
        if (number != null && number >= 1 && number <= documents.size()) {
            return List.of(documents.get(number - 1));
        }
        return documents;
    }

    static boolean isNegative(String content) {
        if (content == null || content.isBlank()) {
            return true;
        }
        String normalized = content.trim();
        if (normalized.toUpperCase(Locale.ROOT).contains(NOT_FOUND_MARKER)) {
            return true;
        }
        String lower = normalized.toLowerCase(Locale.ROOT);
        String head = lower.length() > 120 ? lower.substring(0, 120) : lower;
        return NEGATIVE_PHRASES.stream().anyMatch(head::contains);
    }

    private static QueryAnswer answer(String text, String model, TokenUsage usage, List<String> errors, boolean found) {
        return QueryAnswer.builder()
                .answer(text)
                .sources(found ? new ArrayList<>(List.of(ContextFragment.Kind.RETRIEVAL.source())) : new ArrayList<>())
                .model(model)
                .usage(usage)
                .metadata(AnswerMetadata.builder()
                        .usedRetrieval(true)
                        .usedLegal(false)
                        .intent(QueryIntent.DOCUMENT_SWEEP.name())
                        .contextCount(found ? 1 : 0)
                        .errors(new ArrayList<>(errors))
                        .build())
                .build();
    }

    private record Hit(StoredDocumentInfo document, GenerationResult result) {
    }
}
