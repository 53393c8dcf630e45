package bbt.tao.lexroute.classifier;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Детерминированная классификация по ключевым словам. Используется, когда LLM недоступна
 * или вернула невалидный ответ, и для полей, которые LLM не определяет.
 *
 * <p>Порядок проверок:</p>
 * <ol>
 *   <li>пустой запрос: оба источника;</li>
 *   <li>удаление всех документов, удаление одного документа;</li>
 *   <li>просьба показать список документов;</li>
 *   <li>явное "мої документи": только документы, поиск по каждому документу;</li>
 *   <li>номер дела: только судебная практика (с фразой "повний текст" отдельное намерение);</li>
 *   <li>юридические слова: практика, документы только если есть и слова о документах;</li>
 *   <li>слова о документах: только документы;</li>
 *   <li>иначе оба источника.</li>
 * </ol>
 */
public class RuleBasedClassifier {

    static final List<String> LAW_KEYWORDS = List.of(
            "суд", "судова", "справа", "рішення", "закон", "стаття",
            "кодекс", "норма", "юридична", "правова", "законодавство");

    static final List<String> DOCUMENT_KEYWORDS = List.of(
            "договір", "контракт", "справка", "чек", "наклад",
            "документ", "файл", "архів");

    static final List<String> MY_DOCUMENTS_PHRASES = List.of(
            "мої документи", "моїх документ", "моїми документ", "моєму документі", "моїх файл", "мої файли",
            "мои документы", "моих документ", "my documents");

    static final List<String> LIST_PHRASES = List.of(
            "які документи", "список документів", "перелік документів", "покажи документи", "які файли",
            "какие документы", "список документов", "list documents");

    static final List<String> DELETE_ALL_PHRASES = List.of(
            "видали всі документи", "видалити всі документи", "видали усі документи", "видалити усі документи",
            "очисти всі документи", "удали все документы", "удалить все документы", "delete all documents");

    static final List<String> DELETE_ONE_PHRASES = List.of(
            "видали документ", "видалити документ", "видали файл", "видалити файл",
            "удали документ", "удалить документ", "delete document");

    static final List<String> FULL_TEXT_PHRASES = List.of(
            "повний текст", "повного тексту", "текст рішення", "текст постанови", "полный текст", "full text");

    private static final Pattern DOCUMENT_NUMBER = Pattern.compile(
            "(?:документ|файл)\\p{L}*\\s*(?:№|#|номер)?\\s*(\\d{1,4})(?!\\d|/)", Pattern.UNICODE_CASE | Pattern.CASE_INSENSITIVE);

    public Classification classify(String query) {
        String text = query == null ? "" : query.trim().toLowerCase(Locale.ROOT);
        if (text.isEmpty()) {
            return Classification.bothSources();
        }
        Integer documentNumber = extractDocumentNumber(text).orElse(null);
        // номер дела фиксируется при любом намерении, даже если документные фразы важнее
        String caseNumber = CaseNumberExtractor.findByPattern(text).orElse(null);
        boolean hasCaseNumber = caseNumber != null;

        if (containsAny(text, DELETE_ALL_PHRASES)) {
            return new Classification(true, false, QueryIntent.DELETE_ALL_DOCUMENTS, hasCaseNumber, caseNumber, null, false);
        }
        if (containsAny(text, DELETE_ONE_PHRASES)) {
            return new Classification(true, false, QueryIntent.DELETE_DOCUMENT, hasCaseNumber, caseNumber, documentNumber, false);
        }
        if (containsAny(text, LIST_PHRASES)) {
            return new Classification(true, false, QueryIntent.LIST_DOCUMENTS, hasCaseNumber, caseNumber, null, false);
        }
        if (containsAny(text, MY_DOCUMENTS_PHRASES)) {
            return new Classification(true, false, QueryIntent.DOCUMENT_SWEEP, hasCaseNumber, caseNumber, documentNumber, false);
        }

        if (hasCaseNumber) {
            boolean fullText = isFullTextRequest(text);
            QueryIntent intent = fullText ? QueryIntent.FULL_TEXT_BY_CASE_NUMBER : QueryIntent.GENERAL;
            return new Classification(false, true, intent, true, caseNumber, null, fullText);
        }

        boolean legal = containsAny(text, LAW_KEYWORDS);
        boolean documents = containsAny(text, DOCUMENT_KEYWORDS);
        if (legal) {
            return new Classification(documents, true, QueryIntent.GENERAL, false, null, documentNumber, false);
        }
        if (documents) {
            return new Classification(true, false, QueryIntent.GENERAL, false, null, documentNumber, false);
        }
        return Classification.bothSources();
    }

    public boolean isFullTextRequest(String query) {
        return query != null && containsAny(query.toLowerCase(Locale.ROOT), FULL_TEXT_PHRASES);
    }

    public Optional<Integer> extractDocumentNumber(String query) {
        if (query == null) {
            return Optional.empty();
        }
        Matcher matcher = DOCUMENT_NUMBER.matcher(query);
        if (matcher.find()) {
            return Optional.of(Integer.parseInt(matcher.group(1)));
        }
        return Optional.empty();
    }

    private static boolean containsAny(String text, List<String> needles) {
        for (String needle : needles) {
            if (text.contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
