package ipma.weather.sdk.cache;

/**
 * Элемент кэша: хранит значение и время вставки.
 */
public class CacheEntry<V> {
    public final V value;
    public final long insertedAtMillis; // время вставки в миллисекундах

    public CacheEntry(V value, long insertedAtMillis) {
        this.value = value;
        this.insertedAtMillis = insertedAtMillis;
    }

    public boolean isExpired(long nowMillis, long ttlMillis) {
        return nowMillis - insertedAtMillis > ttlMillis;
    }
}
