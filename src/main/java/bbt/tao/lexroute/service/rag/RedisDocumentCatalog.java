package bbt.tao.lexroute.service.rag;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.util.StringUtils;
import redis.clients.jedis.JedisPooled;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Каталог документов в Redis: hash на документ и set с именами.
 */
public class RedisDocumentCatalog implements DocumentCatalog {

    private static final String FIELD_TYPE = "type";
    private static final String FIELD_CHUNK_IDS = "chunk_ids";
    private static final String FIELD_CHUNKS = "chunks";
    private static final String INDEX_SUFFIX = "names";
    private static final String ENTRY_SUFFIX = "entry:";

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private final JedisPooled jedis;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;

    public RedisDocumentCatalog(JedisPooled jedis, ObjectMapper objectMapper, String keyPrefix) {
        this.jedis = jedis;
        this.objectMapper = objectMapper;
        this.keyPrefix = keyPrefix;
    }

    @Override
    public void save(CatalogEntry entry) {
        try {
            jedis.hset(key(entry.name()), Map.of(
                    FIELD_TYPE, entry.type(),
                    FIELD_CHUNK_IDS, objectMapper.writeValueAsString(entry.chunkIds()),
                    FIELD_CHUNKS, objectMapper.writeValueAsString(entry.chunkTexts())
            ));
            jedis.sadd(indexKey(), entry.name());
        } catch (Exception ex) {
            throw new IllegalStateException("Не удалось сохранить документ '" + entry.name() + "' в каталог", ex);
        }
    }

    @Override
    public Optional<CatalogEntry> find(String name) {
        Map<String, String> fields = jedis.hgetAll(key(name));
        if (fields == null || fields.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new CatalogEntry(
                    name,
                    fields.getOrDefault(FIELD_TYPE, "unknown"),
                    readList(fields.get(FIELD_CHUNK_IDS)),
                    readList(fields.get(FIELD_CHUNKS))
            ));
        } catch (Exception ex) {
            throw new IllegalStateException("Не удалось прочитать документ '" + name + "' из каталога", ex);
        }
    }

    @Override
    public List<String> names() {
        return jedis.smembers(indexKey()).stream().sorted().toList();
    }

    @Override
    public boolean remove(String name) {
        long removed = jedis.srem(indexKey(), name);
        long deleted = jedis.del(key(name));
        return removed > 0 || deleted > 0;
    }

    private List<String> readList(String json) throws Exception {
        if (!StringUtils.hasText(json)) {
            return List.of();
        }
        return objectMapper.readValue(json, STRING_LIST);
    }

    private String key(String name) {
        return keyPrefix + ENTRY_SUFFIX + name;
    }

    private String indexKey() {
        return keyPrefix + INDEX_SUFFIX;
    }
}
