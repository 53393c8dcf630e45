package bbt.tao.lexroute.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Внешнее key-value хранилище для кэша ответов и фрагментов контекста.
 * Методы блокирующие; вызывающий код сам уводит их с event loop.
 */
public interface KeyValueCache {

    Optional<String> get(String key);

    void set(String key, String value, Duration ttl);

    boolean delete(String key);

    /**
     * @return число удалённых ключей
     */
    long deleteByPrefix(String prefix);

    boolean ping();
}
