package bbt.tao.lexroute;

import bbt.tao.lexroute.cache.CacheKeys;
import bbt.tao.lexroute.cache.QueryCache;
import bbt.tao.lexroute.conf.LexRouteProperties;
import bbt.tao.lexroute.resilience.CircuitRegistry;
import bbt.tao.lexroute.resilience.ResilienceMiddleware;
import bbt.tao.lexroute.service.rag.DocumentService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class DocumentServiceTest {

    private InMemoryKeyValueCache store;
    private QueryCache cache;
    private InMemoryRetrievalBackend backend;
    private DocumentService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryKeyValueCache();
        cache = new QueryCache(store, new ObjectMapper(), new LexRouteProperties.CacheSettings());
        backend = new InMemoryRetrievalBackend().withDocument("a.txt", "contract", "Договір оренди");
        service = new DocumentService(backend, new ResilienceMiddleware(new CircuitRegistry(new MutableClock())),
                TestPolicies.fast(), cache);
    }

    @Test
    void deletingDocumentInvalidatesRetrievalCache() {
        cache.putRetrievalContext("оренда", 5, "старий контекст").block();

        StepVerifier.create(service.deleteDocument("a.txt")).expectNext(true).verifyComplete();

        StepVerifier.create(cache.retrievalContext("оренда", 5)).verifyComplete();
    }

    @Test
    void deletingMissingDocumentKeepsCache() {
        cache.putRetrievalContext("оренда", 5, "контекст").block();

        StepVerifier.create(service.deleteDocument("ghost.txt")).expectNext(false).verifyComplete();

        assertThat(store.countWithPrefix(CacheKeys.RETRIEVAL_CONTEXT)).isEqualTo(1);
    }

    @Test
    void addingDocumentInvalidatesRetrievalCache() {
        cache.putRetrievalContext("оренда", 5, "контекст").block();

        StepVerifier.create(service.addDocument("b.txt", "Акт виконаних робіт"))
                .assertNext(info -> assertThat(info.name()).isEqualTo("b.txt"))
                .verifyComplete();

        assertThat(store.countWithPrefix(CacheKeys.RETRIEVAL_PREFIX)).isZero();
        StepVerifier.create(service.listDocuments())
                .assertNext(list -> assertThat(list).hasSize(2))
                .verifyComplete();
    }

    @Test
    void blankDocumentIsRejected() {
        StepVerifier.create(service.addDocument("c.txt", "  ")).expectError(IllegalArgumentException.class).verify();
    }
}
