package bbt.tao.lexroute.service.rag;

import bbt.tao.lexroute.cache.QueryCache;
import bbt.tao.lexroute.resilience.ResilienceMiddleware;
import bbt.tao.lexroute.resilience.ResiliencePolicies;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Изменение и чтение набора документов через слой отказоустойчивости.
 * Каждое успешное добавление или удаление сбрасывает retrieval-кэш.
 */
@Slf4j
public class DocumentService {

    private final RetrievalBackend backend;
    private final ResilienceMiddleware middleware;
    private final ResiliencePolicies policies;
    private final QueryCache cache;

    public DocumentService(RetrievalBackend backend,
                           ResilienceMiddleware middleware,
                           ResiliencePolicies policies,
                           QueryCache cache) {
        this.backend = backend;
        this.middleware = middleware;
        this.policies = policies;
        this.cache = cache;
    }

    public Mono<List<StoredDocumentInfo>> listDocuments() {
        return middleware.offload(policies.retrieval(), backend::listDocuments)
                .defaultIfEmpty(List.of());
    }

    public Mono<List<DocumentChunk>> getDocumentChunks(String name) {
        return middleware.offload(policies.retrieval(), () -> backend.getDocumentChunks(name))
                .defaultIfEmpty(List.of());
    }

    public Mono<StoredDocumentInfo> addDocument(String name, String text) {
        if (name == null || name.isBlank()) {
            return Mono.error(new IllegalArgumentException("Document name must not be blank"));
        }
        if (text == null || text.isBlank()) {
            return Mono.error(new IllegalArgumentException("Document text must not be blank"));
        }
        return middleware.offload(policies.retrieval().withMaxAttempts(1), () -> backend.addDocument(name, text))
                .doOnNext(info -> cache.invalidateRetrieval());
    }

    /**
     * @return {@code true}, если документ существовал и был удалён
     */
    public Mono<Boolean> deleteDocument(String name) {
        return middleware.offload(policies.retrieval().withMaxAttempts(1), () -> backend.deleteDocument(name))
                .defaultIfEmpty(false)
                .doOnNext(deleted -> {
                    if (deleted) {
                        cache.invalidateRetrieval();
                    }
                });
    }
}
