package bbt.tao.lexroute.service.intent;

import bbt.tao.lexroute.classifier.QueryIntent;
import bbt.tao.lexroute.dto.api.AnswerMetadata;
import bbt.tao.lexroute.dto.api.QueryAnswer;
import bbt.tao.lexroute.service.llm.TokenUsage;
import bbt.tao.lexroute.service.rag.DocumentService;
import bbt.tao.lexroute.service.rag.StoredDocumentInfo;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Удаление документов по запросу пользователя без вызова генерации.
 * Если документ нельзя однозначно определить, возвращается нумерованный список для уточнения.
 */
@Slf4j
public class DocumentDeletionHandler {

    static final String MODEL = "none";
    static final String NO_DOCUMENTS = "Немає завантажених документів.";

    private static final Set<String> STOP_WORDS = Set.of(
            "видали", "видалити", "видаліть", "удали", "удалить", "delete", "remove",
            "документ", "документи", "документа", "файл", "файли", "файла", "document", "file",
            "мій", "мої", "мого", "цей", "той", "будь", "ласка", "please", "the");

    private static final int MIN_TOKEN = 3;
    private static final int FULL_NAME_SCORE = 10;

    private final DocumentService documents;

    public DocumentDeletionHandler(DocumentService documents) {
        this.documents = documents;
    }

    public Mono<QueryAnswer> deleteAll(List<StoredDocumentInfo> stored) {
        if (stored.isEmpty()) {
            return Mono.just(answer(NO_DOCUMENTS, QueryIntent.DELETE_ALL_DOCUMENTS, List.of()));
        }
        List<String> errors = new CopyOnWriteArrayList<>();
        return Flux.fromIterable(stored)
                .concatMap(doc -> documents.deleteDocument(doc.name())
                        .onErrorResume(e -> {
                            log.warn("Не удалось удалить '{}': {}", doc.name(), e.toString());
                            errors.add(doc.name() + ": " + e.getMessage());
                            return Mono.just(false);
                        }))
                .filter(Boolean::booleanValue)
                .count()
                .map(deleted -> {
                    log.info("Удалено документов: {} из {}", deleted, stored.size());
                    StringBuilder text = new StringBuilder("Видалено документів: ")
                            .append(deleted).append(" з ").append(stored.size()).append('.');
                    if (!errors.isEmpty()) {
                        text.append("\nПомилки:");
                        errors.forEach(error -> text.append("\n- ").append(error));
                    }
                    return answer(text.toString(), QueryIntent.DELETE_ALL_DOCUMENTS, errors);
                });
    }

    public Mono<QueryAnswer> deleteOne(String query, List<StoredDocumentInfo> stored, Integer documentNumber) {
        if (stored.isEmpty()) {
            return Mono.just(answer(NO_DOCUMENTS, QueryIntent.DELETE_DOCUMENT, List.of()));
        }
        StoredDocumentInfo target = documentNumber != null && documentNumber >= 1 && documentNumber <= stored.size()
                ? stored.get(documentNumber - 1)
                : match(query, stored);
        if (target == null) {
            return Mono.just(answer(disambiguation(stored), QueryIntent.DELETE_DOCUMENT, List.of()));
        }
        return documents.deleteDocument(target.name())
                .map(deleted -> deleted
                        ? answer("Документ «" + target.name() + "» видалено.", QueryIntent.DELETE_DOCUMENT, List.of())
                        : answer("Документ «" + target.name() + "» не знайдено.", QueryIntent.DELETE_DOCUMENT, List.of()))
                .onErrorResume(e -> {
                    log.warn("Не удалось удалить '{}': {}", target.name(), e.toString());
                    return Mono.just(answer("Не вдалося видалити документ «" + target.name() + "»: " + e.getMessage(),
                            QueryIntent.DELETE_DOCUMENT, List.of(target.name() + ": " + e.getMessage())));
                });
    }

    /**
     * @return единственный документ с наибольшим числом совпавших слов, {@code null} при ничьей или отсутствии совпадений
     */
    static StoredDocumentInfo match(String query, List<StoredDocumentInfo> stored) {
        String lowerQuery = query == null ? "" : query.toLowerCase(Locale.ROOT);
        List<String> tokens = tokens(query).stream().filter(token -> !STOP_WORDS.contains(token)).toList();
        StoredDocumentInfo best = null;
        int bestScore = 0;
        boolean tie = false;
        for (StoredDocumentInfo doc : stored) {
            String name = doc.name().toLowerCase(Locale.ROOT);
            List<String> nameTokens = tokens(name);
            int score = lowerQuery.contains(name) ? FULL_NAME_SCORE : 0;
            for (String token : tokens) {
                if (name.equals(token) || nameTokens.contains(token)) {
                    score += 2;
                } else if (name.contains(token)) {
                    score += 1;
                }
            }
            if (score > bestScore) {
                best = doc;
                bestScore = score;
                tie = false;
            } else if (score > 0 && score == bestScore) {
                tie = true;
            }
        }
        return tie ? null : best;
    }

    private static List<String> tokens(String text) {
        if (text == null) {
            return List.of();
        }
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+"))
                .filter(token -> token.length() >= MIN_TOKEN)
                .toList();
    }

    private static String disambiguation(List<StoredDocumentInfo> stored) {
        StringBuilder text = new StringBuilder("Не вдалося однозначно визначити документ. Уточніть, який видалити:");
        for (int i = 0; i < stored.size(); i++) {
            text.append('\n').append(i + 1).append(". ").append(stored.get(i).name());
        }
        return text.toString();
    }

    private static QueryAnswer answer(String text, QueryIntent intent, List<String> errors) {
        return QueryAnswer.builder()
                .answer(text)
                .sources(new ArrayList<>())
                .model(MODEL)
                .usage(TokenUsage.EMPTY)
                .metadata(AnswerMetadata.builder()
                        .usedRetrieval(true)
                        .usedLegal(false)
                        .intent(intent.name())
                        .contextCount(0)
                        .errors(new ArrayList<>(errors))
                        .build())
                .build();
    }
}
