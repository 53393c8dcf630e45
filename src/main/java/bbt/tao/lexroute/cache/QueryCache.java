package bbt.tao.lexroute.cache;

import bbt.tao.lexroute.classifier.Classification;
import bbt.tao.lexroute.conf.LexRouteProperties;
import bbt.tao.lexroute.dto.api.QueryAnswer;
import bbt.tao.lexroute.service.rag.RetrievedChunk;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Типизированный кэш поверх {@link KeyValueCache}: классификация, номер дела, результаты поиска,
 * фрагменты контекста и итоговый ответ, каждый со своим TTL.
 *
 * <p>Ошибки хранилища никогда не доходят до вызывающего: чтение превращается в промах,
 * запись пропускается, всё логируется.</p>
 */
@Slf4j
public class QueryCache {

    private static final TypeReference<List<RetrievedChunk>> CHUNK_LIST = new TypeReference<>() {};

    private final KeyValueCache cache;
    private final ObjectMapper objectMapper;
    private final LexRouteProperties.CacheSettings settings;

    public QueryCache(KeyValueCache cache, ObjectMapper objectMapper, LexRouteProperties.CacheSettings settings) {
        this.cache = cache;
        this.objectMapper = objectMapper;
        this.settings = settings;
    }

    public Mono<Classification> classification(String query) {
        return read(CacheKeys.classification(query), objectMapper.constructType(Classification.class));
    }

    public Mono<Void> putClassification(String query, Classification classification) {
        return write(CacheKeys.classification(query), classification, settings.getTtl().getClassification());
    }

    /**
     * Пустая строка в кэше означает "номера нет" и тоже считается попаданием.
     */
    public Mono<String> caseNumber(String query) {
        return read(CacheKeys.caseNumber(query), objectMapper.constructType(String.class));
    }

    public Mono<Void> putCaseNumber(String query, String caseNumber) {
        return write(CacheKeys.caseNumber(query), caseNumber == null ? "" : caseNumber, settings.getTtl().getCaseNumber());
    }

    public Mono<List<RetrievedChunk>> searchResults(String query, int topK) {
        return read(CacheKeys.retrievalSearch(query, topK), objectMapper.getTypeFactory().constructType(CHUNK_LIST));
    }

    public Mono<Void> putSearchResults(String query, int topK, List<RetrievedChunk> chunks) {
        return write(CacheKeys.retrievalSearch(query, topK), chunks, settings.getTtl().getRetrievalResults());
    }

    public Mono<String> retrievalContext(String query, int topK) {
        return read(CacheKeys.retrievalContext(query, topK), objectMapper.constructType(String.class));
    }

    public Mono<Void> putRetrievalContext(String query, int topK, String context) {
        return write(CacheKeys.retrievalContext(query, topK), context, settings.getTtl().getRetrievalContext());
    }

    public Mono<String> legalContext(String query, String caseNumber, boolean fullText) {
        return read(CacheKeys.legalContext(query, caseNumber, fullText), objectMapper.constructType(String.class));
    }

    public Mono<Void> putLegalContext(String query, String caseNumber, boolean fullText, String context) {
        return write(CacheKeys.legalContext(query, caseNumber, fullText), context, settings.getTtl().getLegalContext());
    }

    public Mono<QueryAnswer> answer(String key) {
        return read(key, objectMapper.constructType(QueryAnswer.class));
    }

    public Mono<Void> putAnswer(String key, QueryAnswer answer) {
        return write(key, answer, settings.getTtl().getAnswer());
    }

    /**
     * Сбрасывает все ключи с префиксом {@code rag:}. Вызывается после изменения набора документов.
     *
     * @return число удалённых ключей, 0 при ошибке хранилища
     */
    public long invalidateRetrieval() {
        if (!settings.isEnabled()) {
            return 0;
        }
        try {
            long removed = cache.deleteByPrefix(CacheKeys.RETRIEVAL_PREFIX);
            log.info("Кэш retrieval сброшен: удалено {} ключей", removed);
            return removed;
        } catch (RuntimeException e) {
            log.warn("Не удалось сбросить кэш retrieval: {}", e.getMessage());
            return 0;
        }
    }

    public boolean isHealthy() {
        try {
            return cache.ping();
        } catch (RuntimeException e) {
            log.warn("Хранилище кэша недоступно: {}", e.getMessage());
            return false;
        }
    }

    private <T> Mono<T> read(String key, JavaType type) {
        if (!settings.isEnabled()) {
            return Mono.empty();
        }
        return Mono.fromCallable(() -> this.<T>lookup(key, type))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(Mono::justOrEmpty);
    }

    private <T> Optional<T> lookup(String key, JavaType type) {
        Optional<String> raw;
        try {
            raw = cache.get(key);
        } catch (RuntimeException e) {
            log.warn("Ошибка чтения кэша '{}': {}", key, e.getMessage());
            return Optional.empty();
        }
        if (raw.isEmpty()) {
            log.debug("Кэш промах: {}", key);
            return Optional.empty();
        }
        try {
            T value = objectMapper.readValue(raw.get(), type);
            log.debug("Кэш попадание: {}", key);
            return Optional.ofNullable(value);
        } catch (Exception e) {
            log.warn("Повреждённая запись кэша '{}', игнорируем: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private Mono<Void> write(String key, Object value, Duration ttl) {
        if (!settings.isEnabled() || value == null) {
            return Mono.empty();
        }
        return Mono.fromRunnable(() -> store(key, value, ttl))
                .subscribeOn(Schedulers.boundedElastic())
                .then();
    }

    private void store(String key, Object value, Duration ttl) {
        try {
            cache.set(key, objectMapper.writeValueAsString(value), ttl);
        } catch (Exception e) {
            log.warn("Не удалось записать кэш '{}': {}", key, e.getMessage());
        }
    }
}
