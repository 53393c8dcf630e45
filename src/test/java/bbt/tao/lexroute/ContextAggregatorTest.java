package bbt.tao.lexroute;

import bbt.tao.lexroute.cache.QueryCache;
import bbt.tao.lexroute.classifier.Classification;
import bbt.tao.lexroute.classifier.QueryIntent;
import bbt.tao.lexroute.classifier.RuleBasedClassifier;
import bbt.tao.lexroute.conf.LexRouteProperties;
import bbt.tao.lexroute.dto.api.QueryOptions;
import bbt.tao.lexroute.resilience.CircuitRegistry;
import bbt.tao.lexroute.resilience.ResilienceMiddleware;
import bbt.tao.lexroute.service.context.AggregatedContext;
import bbt.tao.lexroute.service.context.ContextAggregator;
import bbt.tao.lexroute.service.context.ContextBudgets;
import bbt.tao.lexroute.service.context.ContextFragment;
import bbt.tao.lexroute.service.rag.StoredDocumentInfo;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ContextAggregatorTest {

    private InMemoryRetrievalBackend retrieval;
    private FakeLegalSearchBackend legal;
    private ContextAggregator aggregator;

    @BeforeEach
    void setUp() {
        retrieval = new InMemoryRetrievalBackend()
                .withDocument("lease.txt", "contract", "Договір оренди квартири, орендна плата 10 000 грн")
                .withDocument("act.txt", "act", "Акт виконаних робіт за травень");
        legal = new FakeLegalSearchBackend()
                .withCase("101", "756/655/23", "Про стягнення орендної плати", "ПОВНИЙ ТЕКСТ РІШЕННЯ");
        QueryCache cache = new QueryCache(new InMemoryKeyValueCache(), new ObjectMapper(), new LexRouteProperties.CacheSettings());
        aggregator = new ContextAggregator(retrieval, legal,
                new ResilienceMiddleware(new CircuitRegistry(new MutableClock())), TestPolicies.fast(), cache,
                new LexRouteProperties.Rag(), new LexRouteProperties.Law());
    }

    @Test
    void summaryReportsDocumentCount() {
        String query = "Скільки документів я завантажив?";
        Classification classification = new RuleBasedClassifier().classify(query).withSources(false, false);

        StepVerifier.create(aggregator.aggregate(query, classification, retrieval.listDocuments(), QueryOptions.defaults()))
                .assertNext(context -> {
                    assertThat(context.fragments()).hasSize(1);
                    ContextFragment summary = context.fragments().get(0);
                    assertThat(summary.kind()).isEqualTo(ContextFragment.Kind.SUMMARY);
                    assertThat(summary.text()).startsWith("Кількість документів: 2");
                    assertThat(summary.text()).contains("lease.txt", "act.txt");
                    assertThat(context.sources()).doesNotContain((String) null);
                })
                .verifyComplete();
        assertThat(retrieval.searchCalls).hasValue(0);
        assertThat(legal.searchCalls).hasValue(0);
    }

    @Test
    void legalSearchRendersOnlyLeadingCases() {
        for (int i = 2; i <= 5; i++) {
            legal.withCase("10" + i, "756/65" + i + "/23", "Справа про оренду " + i, null);
        }
        Classification legalOnly = Classification.bothSources().withSources(false, true);

        StepVerifier.create(aggregator.aggregate("орендна плата", legalOnly, List.of(), QueryOptions.defaults()))
                .assertNext(context -> {
                    String text = context.fragments().get(0).text();
                    assertThat(text).contains("1. ", "2. ", "3. ");
                    assertThat(text).doesNotContain("4. ", "5. ");
                    assertThat(text).doesNotContain("Справа про оренду 4");
                })
                .verifyComplete();
    }

    @Test
    void fragmentsFollowPriorityOrder() {
        Classification both = Classification.bothSources();

        StepVerifier.create(aggregator.aggregate("орендна плата", both, retrieval.listDocuments(), QueryOptions.defaults()))
                .assertNext(context -> {
                    assertThat(context.fragments()).extracting(ContextFragment::kind).containsExactly(
                            ContextFragment.Kind.SUMMARY, ContextFragment.Kind.RETRIEVAL, ContextFragment.Kind.LEGAL);
                    assertThat(context.sources()).containsExactly("RAG", "MCP_Law");
                    assertThat(context.errors()).isEmpty();
                })
                .verifyComplete();
    }

    @Test
    void failingLegalBranchIsRecordedAndOthersSurvive() {
        legal.failure = new IllegalStateException("MCP down");

        StepVerifier.create(aggregator.aggregate("орендна плата", Classification.bothSources(),
                        retrieval.listDocuments(), QueryOptions.defaults()))
                .assertNext(context -> {
                    assertThat(context.sources()).containsExactly("RAG");
                    assertThat(context.errors()).singleElement().asString().startsWith("Law MCP error: ").contains("MCP down");
                })
                .verifyComplete();
    }

    @Test
    void failingRetrievalBranchIsRecorded() {
        retrieval.searchFailure = new IllegalStateException("index missing");

        StepVerifier.create(aggregator.aggregate("орендна плата", Classification.bothSources(),
                        retrieval.listDocuments(), QueryOptions.defaults()))
                .assertNext(context -> {
                    assertThat(context.sources()).containsExactly("MCP_Law");
                    assertThat(context.errors()).singleElement().asString().startsWith("RAG error: ");
                })
                .verifyComplete();
    }

    @Test
    void noDocumentsMeansNoRetrievalCall() {
        StepVerifier.create(aggregator.aggregate("орендна плата", Classification.bothSources(), List.of(), QueryOptions.defaults()))
                .assertNext(context -> assertThat(context.has(ContextFragment.Kind.RETRIEVAL)).isFalse())
                .verifyComplete();
        assertThat(retrieval.searchCalls).hasValue(0);
    }

    @Test
    void retrievalContextIsCachedPerQueryAndTopK() {
        Classification retrievalOnly = new Classification(true, false, QueryIntent.GENERAL, false, null, null, false);
        List<StoredDocumentInfo> documents = retrieval.listDocuments();

        AggregatedContext first = aggregator.aggregate("орендна плата", retrievalOnly, documents, QueryOptions.defaults()).block();
        AggregatedContext second = aggregator.aggregate("орендна плата", retrievalOnly, documents, QueryOptions.defaults()).block();

        assertThat(second.fingerprint()).isEqualTo(first.fingerprint());
        assertThat(retrieval.searchCalls).hasValue(1);
    }

    @Test
    void caseNumberFetchesDetailsAndFullText() {
        Classification fullText = new Classification(false, true, QueryIntent.FULL_TEXT_BY_CASE_NUMBER, true,
                "756/655/23", null, true);

        StepVerifier.create(aggregator.aggregate("текст рішення 756/655/23", fullText, List.of(), QueryOptions.defaults()))
                .assertNext(context -> {
                    ContextFragment fragment = context.fragments().get(0);
                    assertThat(fragment.kind()).isEqualTo(ContextFragment.Kind.LEGAL);
                    assertThat(fragment.text()).contains("Справа № 756/655/23", "Господарський суд", "ПОВНИЙ ТЕКСТ РІШЕННЯ");
                })
                .verifyComplete();
        assertThat(legal.searchCalls).hasValue(0);
    }

    @Test
    void longFullTextIsCappedAtCaseBudget() {
        legal.fullTexts.put("101", "т".repeat(ContextBudgets.CASE_FULL_TEXT + 500));
        Classification fullText = new Classification(false, true, QueryIntent.FULL_TEXT_BY_CASE_NUMBER, true,
                "756/655/23", null, true);

        StepVerifier.create(aggregator.aggregate("повний текст 756/655/23", fullText, List.of(), QueryOptions.defaults()))
                .assertNext(context -> {
                    ContextFragment fragment = context.fragments().get(0);
                    assertThat(fragment.truncated()).isTrue();
                    assertThat(fragment.text()).endsWith(ContextBudgets.TRUNCATION_MARKER);
                })
                .verifyComplete();
    }

    @Test
    void listIntentDescribesEveryDocument() {
        Classification list = new Classification(true, false, QueryIntent.LIST_DOCUMENTS, false, null, null, false);

        StepVerifier.create(aggregator.aggregate("які документи", list, retrieval.listDocuments(), QueryOptions.defaults()))
                .assertNext(context -> {
                    ContextFragment listing = context.fragments().get(1);
                    assertThat(listing.kind()).isEqualTo(ContextFragment.Kind.RETRIEVAL);
                    assertThat(listing.text()).contains("1. lease.txt (contract)", "2. act.txt (act)", "Акт виконаних робіт");
                })
                .verifyComplete();
    }
}
