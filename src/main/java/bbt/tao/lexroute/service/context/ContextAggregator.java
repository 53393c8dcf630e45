package bbt.tao.lexroute.service.context;

import bbt.tao.lexroute.cache.QueryCache;
import bbt.tao.lexroute.classifier.Classification;
import bbt.tao.lexroute.classifier.QueryIntent;
import bbt.tao.lexroute.conf.LexRouteProperties;
import bbt.tao.lexroute.dto.api.QueryOptions;
import bbt.tao.lexroute.resilience.ResilienceMiddleware;
import bbt.tao.lexroute.resilience.ResiliencePolicies;
import bbt.tao.lexroute.service.law.LegalCase;
import bbt.tao.lexroute.service.law.LegalSearchBackend;
import bbt.tao.lexroute.service.rag.DocumentChunk;
import bbt.tao.lexroute.service.rag.RetrievalBackend;
import bbt.tao.lexroute.service.rag.RetrievedChunk;
import bbt.tao.lexroute.service.rag.StoredDocumentInfo;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Параллельный сбор контекста из трёх веток: сводка по документам, документы, судебная практика.
 * Ошибка ветки записывается в {@code errors} и не отменяет остальные ветки.
 */
@Slf4j
public class ContextAggregator {

    static final String SUMMARY_LABEL = "Завантажені документи";
    static final String RETRIEVAL_LABEL = "Контекст з документів";
    static final String LIST_LABEL = "Список документів";
    static final String LEGAL_LABEL = "Судова практика";
    static final String CASE_LABEL = "Судова справа";

    private final RetrievalBackend retrieval;
    private final LegalSearchBackend legal;
    private final ResilienceMiddleware middleware;
    private final ResiliencePolicies policies;
    private final QueryCache cache;
    private final LexRouteProperties.Rag ragSettings;
    private final LexRouteProperties.Law lawSettings;

    public ContextAggregator(RetrievalBackend retrieval,
                             LegalSearchBackend legal,
                             ResilienceMiddleware middleware,
                             ResiliencePolicies policies,
                             QueryCache cache,
                             LexRouteProperties.Rag ragSettings,
                             LexRouteProperties.Law lawSettings) {
        this.retrieval = retrieval;
        this.legal = legal;
        this.middleware = middleware;
        this.policies = policies;
        this.cache = cache;
        this.ragSettings = ragSettings;
        this.lawSettings = lawSettings;
    }

    /**
     * @param documents уже полученный список сохранённых документов; пустой, если документов нет
     */
    public Mono<AggregatedContext> aggregate(String query,
                                             Classification classification,
                                             List<StoredDocumentInfo> documents,
                                             QueryOptions options) {
        int topK = options.getTopK() != null && options.getTopK() > 0 ? options.getTopK() : ragSettings.getTopK();

        Mono<Branch> summary = summaryBranch(documents);
        Mono<Branch> retrievalBranch = classification.useRetrieval() && !documents.isEmpty()
                ? retrievalBranch(query, classification, documents, topK)
                : Mono.just(Branch.EMPTY);
        Mono<Branch> legalBranch = classification.useLegal()
                ? legalBranch(query, classification)
                : Mono.just(Branch.EMPTY);

        return Mono.zip(summary, retrievalBranch, legalBranch)
                .map(branches -> {
                    List<ContextFragment> fragments = new ArrayList<>(3);
                    List<String> errors = new ArrayList<>();
                    for (Branch branch : List.of(branches.getT1(), branches.getT2(), branches.getT3())) {
                        branch.fragment().ifPresent(fragments::add);
                        branch.error().ifPresent(errors::add);
                    }
                    AggregatedContext context = new AggregatedContext(fragments, errors);
                    log.info("Контекст собран: фрагментов={}, ошибок={}, источники={}",
                            fragments.size(), errors.size(), context.sources());
                    return context;
                });
    }

    private Mono<Branch> summaryBranch(List<StoredDocumentInfo> documents) {
        if (documents.isEmpty()) {
            return Mono.just(Branch.EMPTY);
        }
        StringBuilder text = new StringBuilder("Кількість документів: ").append(documents.size());
        for (int i = 0; i < documents.size(); i++) {
            StoredDocumentInfo doc = documents.get(i);
            text.append('\n').append(i + 1).append(". ").append(doc.name())
                    .append(" (тип: ").append(doc.type())
                    .append(", фрагментів: ").append(doc.chunkCount()).append(')');
        }
        return Mono.just(Branch.of(new ContextFragment(ContextFragment.Kind.SUMMARY, SUMMARY_LABEL, text.toString(), false)));
    }

    private Mono<Branch> retrievalBranch(String query, Classification classification,
                                         List<StoredDocumentInfo> documents, int topK) {
        if (classification.intent() == QueryIntent.DOCUMENT_SWEEP) {
            return Mono.just(Branch.EMPTY);
        }
        Mono<ContextFragment> fragment = classification.intent() == QueryIntent.LIST_DOCUMENTS
                ? documentList(documents)
                : retrievalContext(query, topK);
        return fragment
                .map(Branch::of)
                .defaultIfEmpty(Branch.EMPTY)
                .onErrorResume(e -> {
                    log.warn("Ветка документов пропущена: {}", e.toString());
                    return Mono.just(Branch.failed("RAG error: " + e.getMessage()));
                });
    }

    private Mono<ContextFragment> retrievalContext(String query, int topK) {
        return cache.retrievalContext(query, topK)
                .map(cached -> new ContextFragment(ContextFragment.Kind.RETRIEVAL, RETRIEVAL_LABEL, cached,
                        cached.endsWith(ContextBudgets.TRUNCATION_MARKER)))
                .switchIfEmpty(Mono.defer(() -> searchResults(query, topK)
                        .filter(chunks -> !chunks.isEmpty())
                        .flatMap(chunks -> {
                            String joined = chunks.stream()
                                    .map(chunk -> "[" + chunk.source() + "]\n" + chunk.text())
                                    .collect(Collectors.joining("\n\n"));
                            Truncation.Result body = Truncation.apply(joined, ContextBudgets.RETRIEVAL_CONTEXT);
                            return cache.putRetrievalContext(query, topK, body.text())
                                    .thenReturn(new ContextFragment(ContextFragment.Kind.RETRIEVAL, RETRIEVAL_LABEL,
                                            body.text(), body.truncated()));
                        })));
    }

    private Mono<List<RetrievedChunk>> searchResults(String query, int topK) {
        return cache.searchResults(query, topK)
                .switchIfEmpty(Mono.defer(() -> middleware.offload(policies.retrieval(), () -> retrieval.search(query, topK))
                        .flatMap(chunks -> cache.putSearchResults(query, topK, chunks).thenReturn(chunks))));
    }

    private Mono<ContextFragment> documentList(List<StoredDocumentInfo> documents) {
        return Flux.fromIterable(documents)
                .concatMap(doc -> middleware.offload(policies.retrieval(), () -> retrieval.getDocumentChunks(doc.name()))
                        .map(chunks -> describe(doc, chunks)))
                .collectList()
                .map(lines -> {
                    StringBuilder text = new StringBuilder();
                    for (int i = 0; i < lines.size(); i++) {
                        if (i > 0) {
                            text.append('\n');
                        }
                        text.append(i + 1).append(". ").append(lines.get(i));
                    }
                    Truncation.Result body = Truncation.apply(text.toString(), ContextBudgets.RETRIEVAL_CONTEXT);
                    return new ContextFragment(ContextFragment.Kind.RETRIEVAL, LIST_LABEL, body.text(), body.truncated());
                });
    }

    private static String describe(StoredDocumentInfo doc, List<DocumentChunk> chunks) {
        String preview = chunks.isEmpty() ? "" : Truncation.preview(chunks.get(0).text(), ContextBudgets.DOCUMENT_PREVIEW);
        return doc.name() + " (" + doc.type() + ")" + (preview.isEmpty() ? "" : "\n   " + preview);
    }

    private Mono<Branch> legalBranch(String query, Classification classification) {
        String caseNumber = classification.caseNumber();
        boolean fullText = classification.fullTextRequested();
        return cache.legalContext(query, caseNumber, fullText)
                .map(cached -> new ContextFragment(ContextFragment.Kind.LEGAL,
                        caseNumber != null ? CASE_LABEL : LEGAL_LABEL, cached,
                        cached.endsWith(ContextBudgets.TRUNCATION_MARKER)))
                .switchIfEmpty(Mono.defer(() -> (caseNumber != null ? caseContext(caseNumber, fullText) : searchContext(query))
                        .flatMap(fragment -> cache.putLegalContext(query, caseNumber, fullText, fragment.text())
                                .thenReturn(fragment))))
                .map(Branch::of)
                .defaultIfEmpty(Branch.EMPTY)
                .onErrorResume(e -> {
                    log.warn("Ветка судебной практики пропущена: {}", e.toString());
                    return Mono.just(Branch.failed("Law MCP error: " + e.getMessage()));
                });
    }

    private Mono<ContextFragment> searchContext(String query) {
        return middleware.call(policies.legalSearch(),
                        () -> legal.searchCases(query, lawSettings.getInstance(), lawSettings.getSearchLimit()))
                .filter(cases -> !cases.isEmpty())
                .map(cases -> {
                    StringBuilder text = new StringBuilder();
                    int shown = Math.min(cases.size(), ContextBudgets.CASES_IN_CONTEXT);
                    for (int i = 0; i < shown; i++) {
                        LegalCase legalCase = cases.get(i);
                        if (i > 0) {
                            text.append('\n');
                        }
                        text.append(i + 1).append(". ").append(legalCase.displayTitle());
                        if (legalCase.caseNumber() != null) {
                            text.append(" [справа № ").append(legalCase.caseNumber()).append(']');
                        }
                        if (legalCase.description() != null && !legalCase.description().isBlank()) {
                            text.append("\n   ").append(Truncation.preview(legalCase.description(), ContextBudgets.CASE_PREVIEW));
                        }
                    }
                    return new ContextFragment(ContextFragment.Kind.LEGAL, LEGAL_LABEL, text.toString(), false);
                });
    }

    private Mono<ContextFragment> caseContext(String caseNumber, boolean fullText) {
        return middleware.call(policies.legalSearch(), () -> legal.getCaseDetails(caseNumber))
                .flatMap(details -> {
                    String header = details.describe(caseNumber);
                    if (!fullText || details.docId() == null) {
                        return Mono.just(new ContextFragment(ContextFragment.Kind.LEGAL, CASE_LABEL, header, false));
                    }
                    return middleware.call(policies.legalSearch(), () -> legal.getCaseFullText(details.docId()))
                            .map(text -> {
                                Truncation.Result body = Truncation.apply(text, ContextBudgets.CASE_FULL_TEXT);
                                return new ContextFragment(ContextFragment.Kind.LEGAL, CASE_LABEL,
                                        header + "\n\nПовний текст рішення:\n" + body.text(), body.truncated());
                            })
                            .defaultIfEmpty(new ContextFragment(ContextFragment.Kind.LEGAL, CASE_LABEL,
                                    header + "\n\nПовний текст рішення недоступний.", false));
                })
                .switchIfEmpty(Mono.fromSupplier(() -> new ContextFragment(ContextFragment.Kind.LEGAL, CASE_LABEL,
                        "Справу № " + caseNumber + " не знайдено в базі судових рішень.", false)));
    }

    private record Branch(Optional<ContextFragment> fragment, Optional<String> error) {

        static final Branch EMPTY = new Branch(Optional.empty(), Optional.empty());

        static Branch of(ContextFragment fragment) {
            return new Branch(Optional.of(fragment), Optional.empty());
        }

        static Branch failed(String error) {
            return new Branch(Optional.empty(), Optional.of(error));
        }
    }
}
