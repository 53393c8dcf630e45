package bbt.tao.lexroute.service.intent;

import bbt.tao.lexroute.classifier.QueryIntent;
import bbt.tao.lexroute.dto.api.AnswerMetadata;
import bbt.tao.lexroute.dto.api.QueryAnswer;
import bbt.tao.lexroute.resilience.ResilienceMiddleware;
import bbt.tao.lexroute.resilience.ResiliencePolicies;
import bbt.tao.lexroute.service.context.ContextFragment;
import bbt.tao.lexroute.service.law.LegalSearchBackend;
import bbt.tao.lexroute.service.llm.TokenUsage;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Полный текст решения по номеру дела без генерации: детали дела, затем текст по docId,
 * ответ отдаётся как есть.
 */
@Slf4j
public class DirectFullTextHandler {

    static final String MODEL = "direct";

    private final LegalSearchBackend legal;
    private final ResilienceMiddleware middleware;
    private final ResiliencePolicies policies;

    public DirectFullTextHandler(LegalSearchBackend legal, ResilienceMiddleware middleware, ResiliencePolicies policies) {
        this.legal = legal;
        this.middleware = middleware;
        this.policies = policies;
    }

    public Mono<QueryAnswer> handle(String caseNumber) {
        log.info("Прямой запрос полного текста по справі {}", caseNumber);
        return middleware.call(policies.legalSearch(), () -> legal.getCaseDetails(caseNumber))
                .flatMap(details -> {
                    String header = details.describe(caseNumber);
                    if (details.docId() == null) {
                        return Mono.just(answer(header + "\n\nПовний текст рішення недоступний.", null));
                    }
                    return middleware.call(policies.legalSearch(), () -> legal.getCaseFullText(details.docId()))
                            .map(text -> answer(header + "\n\n" + text, null))
                            .defaultIfEmpty(answer(header + "\n\nПовний текст рішення недоступний.", null));
                })
                .switchIfEmpty(Mono.fromSupplier(() -> answer("Справу № " + caseNumber + " не знайдено в базі судових рішень.", null)))
                .onErrorResume(e -> {
                    log.error("Не удалось получить полный текст справи {}: {}", caseNumber, e.toString());
                    return Mono.just(answer("Помилка при отриманні повного тексту справи: " + e.getMessage(), e.getMessage()));
                });
    }

    private static QueryAnswer answer(String text, String error) {
        List<String> errors = new ArrayList<>();
        if (error != null) {
            errors.add("Law MCP error: " + error);
        }
        return QueryAnswer.builder()
                .answer(text)
                .sources(error == null ? new ArrayList<>(List.of(ContextFragment.Kind.LEGAL.source())) : new ArrayList<>())
                .model(MODEL)
                .usage(TokenUsage.EMPTY)
                .error(error)
                .metadata(AnswerMetadata.builder()
                        .usedRetrieval(false)
                        .usedLegal(true)
                        .intent(QueryIntent.FULL_TEXT_BY_CASE_NUMBER.name())
                        .contextCount(error == null ? 1 : 0)
                        .errors(errors)
                        .build())
                .build();
    }
}
