package bbt.tao.lexroute.cache;

import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.StringJoiner;

/**
 * Префиксы ключей кэша и их отпечатки. Всё, что начинается с {@link #RETRIEVAL_PREFIX},
 * сбрасывается при добавлении или удалении документа.
 */
public final class CacheKeys {

    public static final String CLASSIFICATION = "classify:";
    public static final String CASE_NUMBER = "case-number:";
    public static final String RETRIEVAL_PREFIX = "rag:";
    public static final String RETRIEVAL_SEARCH = RETRIEVAL_PREFIX + "search:";
    public static final String RETRIEVAL_CONTEXT = RETRIEVAL_PREFIX + "context:";
    public static final String LEGAL_CONTEXT = "law:context:";
    public static final String ANSWER = "llm:answer:";

    private CacheKeys() {
    }

    public static String classification(String query) {
        return CLASSIFICATION + fingerprint(query);
    }

    public static String caseNumber(String query) {
        return CASE_NUMBER + fingerprint(query);
    }

    public static String retrievalSearch(String query, int topK) {
        return RETRIEVAL_SEARCH + fingerprint(query, "top_k=" + topK);
    }

    public static String retrievalContext(String query, int topK) {
        return RETRIEVAL_CONTEXT + fingerprint(query, "top_k=" + topK);
    }

    public static String legalContext(String query, String caseNumber, boolean fullText) {
        return LEGAL_CONTEXT + fingerprint(query, "case=" + caseNumber, "full=" + fullText);
    }

    public static String answer(String query, String provider, String model,
                                boolean useRetrieval, boolean useLegal, String contextFingerprint) {
        return ANSWER + fingerprint(query,
                "provider=" + provider,
                "model=" + model,
                "rag=" + useRetrieval,
                "law=" + useLegal,
                "ctx=" + contextFingerprint);
    }

    public static String fingerprint(String... parts) {
        StringJoiner joiner = new StringJoiner("\u001f");
        for (String part : parts) {
            joiner.add(part == null ? "" : part);
        }
        return DigestUtils.md5DigestAsHex(joiner.toString().getBytes(StandardCharsets.UTF_8));
    }
}
