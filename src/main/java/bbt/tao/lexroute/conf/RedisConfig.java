package bbt.tao.lexroute.conf;

import bbt.tao.lexroute.cache.KeyValueCache;
import bbt.tao.lexroute.cache.QueryCache;
import bbt.tao.lexroute.cache.RedisKeyValueCache;
import bbt.tao.lexroute.service.rag.DocumentCatalog;
import bbt.tao.lexroute.service.rag.DocumentMetadata;
import bbt.tao.lexroute.service.rag.DocumentTypeDetector;
import bbt.tao.lexroute.service.rag.RedisDocumentCatalog;
import bbt.tao.lexroute.service.rag.RetrievalBackend;
import bbt.tao.lexroute.service.rag.VectorStoreRetrievalBackend;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.transformer.splitter.TokenTextSplitter;
import org.springframework.ai.vectorstore.redis.RedisVectorStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import redis.clients.jedis.JedisPooled;

@Configuration
public class RedisConfig {

    private static final Logger logger = LoggerFactory.getLogger(RedisConfig.class);

    private static final String CACHE_NAMESPACE = "lexroute:cache:";

    @Value("${spring.data.redis.host:localhost}")
    private String redisHost;

    @Value("${spring.data.redis.port:6379}")
    private int redisPort;

    @Value("${spring.data.redis.password:}")
    private String redisPassword;

    @Value("${spring.ai.vectorstore.redis.index-name:lexroute-index}")
    private String redisIndex;

    @Value("${spring.ai.vectorstore.redis.prefix:lexroute:chunk:}")
    private String redisPrefix;

    @Bean
    public JedisPooled jedisPooled() {
        logger.info("Создание JedisPooled: {}:{}", redisHost, redisPort);
        String password = StringUtils.hasText(redisPassword) ? redisPassword : null;
        return new JedisPooled(redisHost, redisPort, null, password);
    }

    @Bean
    public TokenTextSplitter textSplitter() {
        logger.info("Создание TokenTextSplitter: чанк 400 токенов");
        return new TokenTextSplitter(400, 60, 20, 2000, true);
    }

    @Bean
    public RedisVectorStore vectorStore(JedisPooled jedisPooled, EmbeddingModel embeddingModel) {
        logger.info("Создание RedisVectorStore с индексом: {} и префиксом: {}", redisIndex, redisPrefix);
        return RedisVectorStore.builder(jedisPooled, embeddingModel)
                .indexName(redisIndex)
                .prefix(redisPrefix)
                .initializeSchema(true)
                .metadataFields(
                        RedisVectorStore.MetadataField.tag(DocumentMetadata.DOCUMENT_NAME),
                        RedisVectorStore.MetadataField.tag(DocumentMetadata.DOCUMENT_TYPE),
                        RedisVectorStore.MetadataField.numeric(DocumentMetadata.CHUNK_INDEX)
                )
                .build();
    }

    @Bean
    public KeyValueCache keyValueCache(JedisPooled jedisPooled) {
        return new RedisKeyValueCache(jedisPooled, CACHE_NAMESPACE);
    }

    @Bean
    public QueryCache queryCache(KeyValueCache keyValueCache, ObjectMapper objectMapper, LexRouteProperties properties) {
        return new QueryCache(keyValueCache, objectMapper, properties.getCache());
    }

    @Bean
    public DocumentCatalog documentCatalog(JedisPooled jedisPooled, ObjectMapper objectMapper, LexRouteProperties properties) {
        return new RedisDocumentCatalog(jedisPooled, objectMapper, properties.getRag().getCatalogPrefix());
    }

    @Bean
    public DocumentTypeDetector documentTypeDetector() {
        return new DocumentTypeDetector();
    }

    @Bean
    public RetrievalBackend retrievalBackend(RedisVectorStore vectorStore,
                                             TokenTextSplitter textSplitter,
                                             DocumentCatalog documentCatalog,
                                             DocumentTypeDetector documentTypeDetector) {
        return new VectorStoreRetrievalBackend(vectorStore, textSplitter, documentCatalog, documentTypeDetector);
    }
}
