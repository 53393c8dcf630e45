package bbt.tao.lexroute;

import bbt.tao.lexroute.cache.KeyValueCache;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

class InMemoryKeyValueCache implements KeyValueCache {

    final Map<String, String> values = new ConcurrentHashMap<>();
    final Map<String, Duration> ttls = new ConcurrentHashMap<>();
    volatile boolean broken;

    @Override
    public Optional<String> get(String key) {
        failIfBroken();
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        failIfBroken();
        values.put(key, value);
        ttls.put(key, ttl);
    }

    @Override
    public boolean delete(String key) {
        failIfBroken();
        ttls.remove(key);
        return values.remove(key) != null;
    }

    @Override
    public long deleteByPrefix(String prefix) {
        failIfBroken();
        long before = values.size();
        values.keySet().removeIf(key -> key.startsWith(prefix));
        ttls.keySet().removeIf(key -> key.startsWith(prefix));
        return before - values.size();
    }

    @Override
    public boolean ping() {
        failIfBroken();
        return true;
    }

    long countWithPrefix(String prefix) {
        return values.keySet().stream().filter(key -> key.startsWith(prefix)).count();
    }

    private void failIfBroken() {
        if (broken) {
            throw new IllegalStateException("cache backend down");
        }
    }
}
