package bbt.tao.lexroute.conf;

import bbt.tao.lexroute.cache.QueryCache;
import bbt.tao.lexroute.classifier.CaseNumberExtractor;
import bbt.tao.lexroute.classifier.QueryClassifier;
import bbt.tao.lexroute.classifier.RuleBasedClassifier;
import bbt.tao.lexroute.resilience.ResilienceMiddleware;
import bbt.tao.lexroute.resilience.ResiliencePolicies;
import bbt.tao.lexroute.service.QueryRouterService;
import bbt.tao.lexroute.service.context.ContextAggregator;
import bbt.tao.lexroute.service.context.PromptAssembler;
import bbt.tao.lexroute.service.intent.DirectFullTextHandler;
import bbt.tao.lexroute.service.intent.DocumentDeletionHandler;
import bbt.tao.lexroute.service.intent.DocumentSweepHandler;
import bbt.tao.lexroute.service.law.LegalSearchBackend;
import bbt.tao.lexroute.service.llm.GenerationBackendRegistry;
import bbt.tao.lexroute.service.rag.DocumentService;
import bbt.tao.lexroute.service.rag.RetrievalBackend;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Сборка конвейера обработки запроса.
 */
@Configuration
public class PipelineConfig {

    @Bean
    public RuleBasedClassifier ruleBasedClassifier() {
        return new RuleBasedClassifier();
    }

    @Bean
    public CaseNumberExtractor caseNumberExtractor(GenerationBackendRegistry backends,
                                                   ResilienceMiddleware middleware,
                                                   ResiliencePolicies policies,
                                                   QueryCache cache) {
        return new CaseNumberExtractor(backends, middleware, policies, cache);
    }

    @Bean
    public QueryClassifier queryClassifier(GenerationBackendRegistry backends,
                                           ResilienceMiddleware middleware,
                                           ResiliencePolicies policies,
                                           QueryCache cache,
                                           RuleBasedClassifier rules,
                                           CaseNumberExtractor caseNumberExtractor,
                                           ObjectMapper objectMapper) {
        return new QueryClassifier(backends, middleware, policies, cache, rules, caseNumberExtractor, objectMapper);
    }

    @Bean
    public DocumentService documentService(RetrievalBackend retrievalBackend,
                                           ResilienceMiddleware middleware,
                                           ResiliencePolicies policies,
                                           QueryCache cache) {
        return new DocumentService(retrievalBackend, middleware, policies, cache);
    }

    @Bean
    public PromptAssembler promptAssembler() {
        return new PromptAssembler();
    }

    @Bean
    public ContextAggregator contextAggregator(RetrievalBackend retrievalBackend,
                                               LegalSearchBackend legalSearchBackend,
                                               ResilienceMiddleware middleware,
                                               ResiliencePolicies policies,
                                               QueryCache cache,
                                               LexRouteProperties properties) {
        return new ContextAggregator(retrievalBackend, legalSearchBackend, middleware, policies, cache,
                properties.getRag(), properties.getLaw());
    }

    @Bean
    public DirectFullTextHandler directFullTextHandler(LegalSearchBackend legalSearchBackend,
                                                       ResilienceMiddleware middleware,
                                                       ResiliencePolicies policies) {
        return new DirectFullTextHandler(legalSearchBackend, middleware, policies);
    }

    @Bean
    public DocumentSweepHandler documentSweepHandler(RetrievalBackend retrievalBackend,
                                                     GenerationBackendRegistry backends,
                                                     ResilienceMiddleware middleware,
                                                     ResiliencePolicies policies,
                                                     PromptAssembler promptAssembler) {
        return new DocumentSweepHandler(retrievalBackend, backends, middleware, policies, promptAssembler);
    }

    @Bean
    public DocumentDeletionHandler documentDeletionHandler(DocumentService documentService) {
        return new DocumentDeletionHandler(documentService);
    }

    @Bean
    public QueryRouterService queryRouterService(QueryClassifier classifier,
                                                 DocumentService documentService,
                                                 ContextAggregator aggregator,
                                                 PromptAssembler promptAssembler,
                                                 GenerationBackendRegistry backends,
                                                 ResilienceMiddleware middleware,
                                                 ResiliencePolicies policies,
                                                 QueryCache cache,
                                                 DirectFullTextHandler fullTextHandler,
                                                 DocumentSweepHandler sweepHandler,
                                                 DocumentDeletionHandler deletionHandler) {
        return new QueryRouterService(classifier, documentService, aggregator, promptAssembler, backends,
                middleware, policies, cache, fullTextHandler, sweepHandler, deletionHandler);
    }
}
