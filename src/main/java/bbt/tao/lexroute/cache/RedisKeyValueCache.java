package bbt.tao.lexroute.cache;

import lombok.extern.slf4j.Slf4j;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.params.ScanParams;
import redis.clients.jedis.resps.ScanResult;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

@Slf4j
public class RedisKeyValueCache implements KeyValueCache {

    private static final int SCAN_BATCH = 500;

    private final JedisPooled jedis;
    private final String namespace;

    public RedisKeyValueCache(JedisPooled jedis, String namespace) {
        this.jedis = jedis;
        this.namespace = namespace == null ? "" : namespace;
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(jedis.get(namespace + key));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            jedis.set(namespace + key, value);
            return;
        }
        jedis.setex(namespace + key, Math.max(1L, ttl.getSeconds()), value);
    }

    @Override
    public boolean delete(String key) {
        return jedis.del(namespace + key) > 0;
    }

    @Override
    public long deleteByPrefix(String prefix) {
        ScanParams params = new ScanParams().match(namespace + prefix + "*").count(SCAN_BATCH);
        String cursor = ScanParams.SCAN_POINTER_START;
        long deleted = 0;
        do {
            ScanResult<String> page = jedis.scan(cursor, params);
            List<String> keys = page.getResult();
            if (!keys.isEmpty()) {
                deleted += jedis.del(keys.toArray(String[]::new));
            }
            cursor = page.getCursor();
        } while (!ScanParams.SCAN_POINTER_START.equals(cursor));
        log.debug("Удалено {} ключей по префиксу '{}'", deleted, prefix);
        return deleted;
    }

    @Override
    public boolean ping() {
        return "PONG".equalsIgnoreCase(jedis.ping());
    }
}
