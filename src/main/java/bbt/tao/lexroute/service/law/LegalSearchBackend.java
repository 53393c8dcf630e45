package bbt.tao.lexroute.service.law;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Внешний сервис судебной практики. "Не найдено" выражается пустым {@link Mono} или пустым списком.
 */
public interface LegalSearchBackend {

    Mono<List<LegalCase>> searchCases(String query, String instance, int limit);

    /**
     * @param caseNumberOrDocId номер дела ({@code 123/456/78}) или идентификатор документа
     */
    Mono<CaseDetails> getCaseDetails(String caseNumberOrDocId);

    Mono<String> getCaseFullText(String docId);
}
