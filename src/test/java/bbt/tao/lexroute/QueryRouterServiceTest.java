package bbt.tao.lexroute;

import bbt.tao.lexroute.cache.QueryCache;
import bbt.tao.lexroute.classifier.CaseNumberExtractor;
import bbt.tao.lexroute.classifier.QueryClassifier;
import bbt.tao.lexroute.classifier.RuleBasedClassifier;
import bbt.tao.lexroute.conf.LexRouteProperties;
import bbt.tao.lexroute.dto.api.QueryAnswer;
import bbt.tao.lexroute.dto.api.QueryOptions;
import bbt.tao.lexroute.resilience.CircuitRegistry;
import bbt.tao.lexroute.resilience.ResilienceMiddleware;
import bbt.tao.lexroute.resilience.ResiliencePolicies;
import bbt.tao.lexroute.service.QueryRouterService;
import bbt.tao.lexroute.service.context.ContextAggregator;
import bbt.tao.lexroute.service.context.PromptAssembler;
import bbt.tao.lexroute.service.intent.DirectFullTextHandler;
import bbt.tao.lexroute.service.intent.DocumentDeletionHandler;
import bbt.tao.lexroute.service.intent.DocumentSweepHandler;
import bbt.tao.lexroute.service.llm.ChatTurn;
import bbt.tao.lexroute.service.llm.GenerationBackendRegistry;
import bbt.tao.lexroute.service.rag.DocumentService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class QueryRouterServiceTest {

    private static final String BOTH_SOURCES = "{\"use_law\": true, \"use_rag\": true, \"query_type\": \"general\"}";

    private InMemoryRetrievalBackend retrieval;
    private FakeLegalSearchBackend legal;
    private ScriptedGenerationBackend llm;
    private DocumentService documents;
    private QueryRouterService router;

    private volatile Supplier<Mono<String>> classifierReply = () -> Mono.just(BOTH_SOURCES);
    private volatile Function<List<ChatTurn>, Mono<String>> answerReply = messages -> Mono.just("Відповідь асистента");
    private final AtomicInteger answerCalls = new AtomicInteger();

    @BeforeEach
    void setUp() {
        retrieval = new InMemoryRetrievalBackend()
                .withDocument("lease.txt", "contract", "Договір оренди квартири, орендна плата 10 000 грн")
                .withDocument("act.txt", "act", "Акт виконаних робіт за травень");
        legal = new FakeLegalSearchBackend()
                .withCase("101", "756/655/23", "Про стягнення орендної плати", "ПОСТАНОВА ІМЕНЕМ УКРАЇНИ");
        llm = new ScriptedGenerationBackend(this::respond);

        GenerationBackendRegistry backends = mock(GenerationBackendRegistry.class);
        when(backends.defaultBackend()).thenReturn(llm);
        when(backends.resolve(any(), any())).thenReturn(llm);

        ObjectMapper objectMapper = new ObjectMapper();
        QueryCache cache = new QueryCache(new InMemoryKeyValueCache(), objectMapper, new LexRouteProperties.CacheSettings());
        ResilienceMiddleware middleware = new ResilienceMiddleware(new CircuitRegistry(new MutableClock()));
        ResiliencePolicies policies = TestPolicies.fast();
        RuleBasedClassifier rules = new RuleBasedClassifier();
        PromptAssembler prompts = new PromptAssembler();

        QueryClassifier classifier = new QueryClassifier(backends, middleware, policies, cache, rules,
                new CaseNumberExtractor(backends, middleware, policies, cache), objectMapper);
        documents = new DocumentService(retrieval, middleware, policies, cache);
        ContextAggregator aggregator = new ContextAggregator(retrieval, legal, middleware, policies, cache,
                new LexRouteProperties.Rag(), new LexRouteProperties.Law());

        router = new QueryRouterService(classifier, documents, aggregator, prompts, backends, middleware, policies, cache,
                new DirectFullTextHandler(legal, middleware, policies),
                new DocumentSweepHandler(retrieval, backends, middleware, policies, prompts),
                new DocumentDeletionHandler(documents));
    }

    @Test
    void generalQueryCombinesAllFragments() {
        StepVerifier.create(router.answer("Яка орендна плата за договором?", QueryOptions.defaults()))
                .assertNext(answer -> {
                    assertThat(answer.getAnswer()).isEqualTo("Відповідь асистента");
                    assertThat(answer.getSources()).containsExactly("RAG", "MCP_Law");
                    assertThat(answer.getModel()).isEqualTo("test-model");
                    assertThat(answer.getUsage().totalTokens()).isEqualTo(15);
                    assertThat(answer.getError()).isNull();
                    assertThat(answer.getMetadata().getIntent()).isEqualTo("GENERAL");
                    assertThat(answer.getMetadata().getContextCount()).isEqualTo(3);
                    assertThat(answer.getMetadata().isCached()).isFalse();
                    assertThat(answer.getMetadata().getErrors()).isEmpty();
                })
                .verifyComplete();

        String prompt = llm.lastUserMessage();
        assertThat(prompt.indexOf("Кількість документів: 2"))
                .isLessThan(prompt.indexOf("орендна плата 10 000 грн"));
        assertThat(prompt.indexOf("орендна плата 10 000 грн"))
                .isLessThan(prompt.indexOf("Про стягнення орендної плати"));
    }

    @Test
    void repeatedQueryIsServedFromAnswerCache() {
        router.answer("Яка орендна плата за договором?", QueryOptions.defaults()).block();
        int callsAfterFirst = llm.calls();

        QueryAnswer second = router.answer("Яка орендна плата за договором?", QueryOptions.defaults()).block();

        assertThat(second.getMetadata().isCached()).isTrue();
        assertThat(second.getAnswer()).isEqualTo("Відповідь асистента");
        assertThat(llm.calls()).isEqualTo(callsAfterFirst);
        assertThat(answerCalls).hasValue(1);
    }

    @Test
    void deletingDocumentForcesFreshRetrieval() {
        router.answer("Яка орендна плата за договором?", QueryOptions.defaults()).block();
        assertThat(retrieval.searchCalls).hasValue(1);

        documents.deleteDocument("act.txt").block();
        router.answer("Яка орендна плата за договором?", QueryOptions.defaults()).block();

        assertThat(retrieval.searchCalls).hasValue(2);
        assertThat(answerCalls).hasValue(2);
    }

    @Test
    void generationFailureBecomesErrorAnswer() {
        answerReply = messages -> Mono.error(new IllegalStateException("model overloaded"));

        StepVerifier.create(router.answer("Яка орендна плата за договором?", QueryOptions.defaults()))
                .assertNext(answer -> {
                    assertThat(answer.getAnswer()).isEqualTo("Помилка при обробці запиту: model overloaded");
                    assertThat(answer.getError()).isEqualTo("model overloaded");
                    assertThat(answer.getMetadata().getErrors()).contains("LLM error: model overloaded");
                    assertThat(answer.getSources()).containsExactly("RAG", "MCP_Law");
                })
                .verifyComplete();
    }

    @Test
    void unreachableClassifierStillRoutesByRules() {
        classifierReply = () -> Mono.error(new IllegalStateException("classifier down"));

        StepVerifier.create(router.answer("Скільки документів я завантажив?", QueryOptions.defaults()))
                .assertNext(answer -> {
                    assertThat(answer.getMetadata().isUsedRetrieval()).isTrue();
                    assertThat(answer.getMetadata().isUsedLegal()).isFalse();
                })
                .verifyComplete();
        assertThat(llm.lastUserMessage()).contains("Кількість документів: 2");
        assertThat(legal.searchCalls).hasValue(0);
    }

    @Test
    void fullTextRequestBypassesGeneration() {
        classifierReply = () -> Mono.just(
                "{\"use_law\": true, \"use_rag\": false, \"has_case_number\": true, \"is_document_text_query\": true}");

        StepVerifier.create(router.answer("Повний текст рішення у справі 756/655/23", QueryOptions.defaults()))
                .assertNext(answer -> {
                    assertThat(answer.getModel()).isEqualTo("direct");
                    assertThat(answer.getAnswer()).contains("Справа № 756/655/23", "ПОСТАНОВА ІМЕНЕМ УКРАЇНИ");
                    assertThat(answer.getSources()).containsExactly("MCP_Law");
                    assertThat(answer.getMetadata().getIntent()).isEqualTo("FULL_TEXT_BY_CASE_NUMBER");
                })
                .verifyComplete();
        assertThat(answerCalls).hasValue(0);
    }

    @Test
    void fullTextCanFlowThroughGenerationWhenBypassDisabled() {
        classifierReply = () -> Mono.just(
                "{\"use_law\": true, \"use_rag\": false, \"has_case_number\": true, \"is_document_text_query\": true}");
        QueryOptions options = QueryOptions.builder().directFullText(false).build();

        StepVerifier.create(router.answer("Повний текст рішення у справі 756/655/23", options))
                .assertNext(answer -> {
                    assertThat(answer.getModel()).isEqualTo("test-model");
                    assertThat(answer.getSources()).containsExactly("MCP_Law");
                })
                .verifyComplete();
        assertThat(llm.lastUserMessage()).contains("ПОСТАНОВА ІМЕНЕМ УКРАЇНИ");
    }

    @Test
    void explicitSourceFlagsBeatClassification() {
        QueryOptions options = QueryOptions.builder().useLegal(false).build();

        StepVerifier.create(router.answer("Яка орендна плата за договором?", options))
                .assertNext(answer -> {
                    assertThat(answer.getSources()).containsExactly("RAG");
                    assertThat(answer.getMetadata().isUsedLegal()).isFalse();
                })
                .verifyComplete();
        assertThat(legal.searchCalls).hasValue(0);
    }

    @Test
    void deleteAllIntentRemovesDocumentsWithoutGeneration() {
        classifierReply = () -> Mono.just(
                "{\"use_law\": false, \"use_rag\": true, \"query_type\": \"delete_all_documents\"}");

        StepVerifier.create(router.answer("Видали всі документи", QueryOptions.defaults()))
                .assertNext(answer -> {
                    assertThat(answer.getAnswer()).contains("Видалено документів: 2 з 2");
                    assertThat(answer.getModel()).isEqualTo("none");
                })
                .verifyComplete();
        assertThat(retrieval.listDocuments()).isEmpty();
        assertThat(answerCalls).hasValue(0);
    }

    @Test
    void sweepWithoutDocumentsFallsBackToAggregation() {
        classifierReply = () -> Mono.just(
                "{\"use_law\": false, \"use_rag\": true, \"query_type\": \"document_sweep\"}");
        retrieval.deleteDocument("lease.txt");
        retrieval.deleteDocument("act.txt");

        StepVerifier.create(router.answer("Що в моїх документах про оренду?", QueryOptions.defaults()))
                .assertNext(answer -> {
                    assertThat(answer.getModel()).isEqualTo("test-model");
                    assertThat(answer.getMetadata().getContextCount()).isZero();
                })
                .verifyComplete();
    }

    @Test
    void documentListFailureIsRecorded() {
        retrieval.listFailure = new IllegalStateException("catalog unavailable");

        StepVerifier.create(router.answer("Яка орендна плата за договором?", QueryOptions.defaults()))
                .assertNext(answer -> {
                    assertThat(answer.getMetadata().getErrors())
                            .anySatisfy(error -> assertThat(error).startsWith("Documents summary error: "));
                    assertThat(answer.getSources()).containsExactly("MCP_Law");
                })
                .verifyComplete();
    }

    @Test
    void streamEmitsGeneratedChunks() {
        llm.streaming(Flux.just("Орендна ", "плата ", "10 000 грн"));

        StepVerifier.create(router.answerStream("Яка орендна плата за договором?", QueryOptions.defaults()))
                .expectNext("Орендна ", "плата ", "10 000 грн")
                .verifyComplete();
    }

    @Test
    void streamFailureEndsWithErrorChunk() {
        llm.streaming(Flux.concat(Flux.just("Орендна "), Flux.error(new IllegalStateException("connection lost"))));

        StepVerifier.create(router.answerStream("Яка орендна плата за договором?", QueryOptions.defaults()))
                .expectNext("Орендна ")
                .expectNext("Помилка: connection lost")
                .verifyComplete();
    }

    private Mono<String> respond(List<ChatTurn> messages) {
        String system = messages.get(0).content();
        if (system.contains("класифікуєш")) {
            return classifierReply.get();
        }
        if (system.contains("витягуєш")) {
            return Mono.just("none");
        }
        answerCalls.incrementAndGet();
        return answerReply.apply(messages);
    }
}
