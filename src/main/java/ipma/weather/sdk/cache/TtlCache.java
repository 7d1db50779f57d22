package ipma.weather.sdk.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Простой кэш ключ-значение с TTL.
 * Истечение ленивое: устаревшая запись удаляется только при чтении, фонового потока нет.
 */
public class TtlCache<V> {
    private static final Logger log = LoggerFactory.getLogger(TtlCache.class);

    private final String name;
    private final long ttlSeconds;
    private final Clock clock;
    private final Map<String, CacheEntry<V>> store = new ConcurrentHashMap<>();

    public TtlCache(String name, long ttlSeconds) {
        this(name, ttlSeconds, Clock.systemUTC());
    }

    public TtlCache(String name, long ttlSeconds, Clock clock) {
        if (ttlSeconds < 0) {
            throw new IllegalArgumentException("TTL не может быть отрицательным: " + ttlSeconds);
        }
        this.name = name;
        this.ttlSeconds = ttlSeconds;
        this.clock = clock;
    }

    /**
     * Возвращает значение, если запись есть и её возраст не превышает TTL.
     * Устаревшая запись удаляется.
     */
    public Optional<V> get(String key) {
        CacheEntry<V> entry = store.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.millis(), ttlSeconds * 1000)) {
            // удаляем именно эту запись: параллельный set мог уже положить свежую
            store.remove(key, entry);
            log.debug("Кэш {}: запись {} устарела и удалена", name, key);
            return Optional.empty();
        }
        return Optional.of(entry.value);
    }

    public void set(String key, V value) {
        store.put(key, new CacheEntry<>(value, clock.millis()));
    }

    public void clear() {
        store.clear();
    }

    /** Количество записей, включая устаревшие, которые ещё никто не читал. */
    public int size() {
        return store.size();
    }
}
