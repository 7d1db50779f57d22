package ipma.weather.sdk;

import io.github.cdimascio.dotenv.Dotenv;

/**
 * Неизменяемая конфигурация клиента: базовый URL и TTL кэшей в секундах.
 */
public final class IpmaSettings {
    public static final String DEFAULT_BASE_URL = "https://api.ipma.pt/open-data";
    public static final long DEFAULT_TTL_LOCALITIES = 12 * 60 * 60; // 12 часов, список локаций меняется редко
    public static final long DEFAULT_TTL_CLASSES = 12 * 60 * 60;
    public static final long DEFAULT_TTL_FORECAST = 30 * 60;

    private final String baseUrl;
    private final long ttlLocalities;
    private final long ttlClasses;
    private final long ttlForecast;

    public IpmaSettings(String baseUrl, long ttlLocalities, long ttlClasses, long ttlForecast) {
        if (baseUrl == null || baseUrl.trim().isEmpty()) {
            throw new IllegalArgumentException("Базовый URL не может быть пустым");
        }
        requireNonNegative("CACHE_TTL_LOCALITIES", ttlLocalities);
        requireNonNegative("CACHE_TTL_CLASSES", ttlClasses);
        requireNonNegative("CACHE_TTL_FORECAST", ttlForecast);
        String trimmed = baseUrl.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        this.baseUrl = trimmed;
        this.ttlLocalities = ttlLocalities;
        this.ttlClasses = ttlClasses;
        this.ttlForecast = ttlForecast;
    }

    public static IpmaSettings defaults() {
        return new IpmaSettings(DEFAULT_BASE_URL, DEFAULT_TTL_LOCALITIES, DEFAULT_TTL_CLASSES, DEFAULT_TTL_FORECAST);
    }

    /**
     * Читает настройки из файла .env или переменных окружения. Файл .env необязателен.
     */
    public static IpmaSettings fromEnvironment() {
        return fromDotenv(Dotenv.configure().ignoreIfMissing().load());
    }

    static IpmaSettings fromDotenv(Dotenv dotenv) {
        return new IpmaSettings(
                dotenv.get("IPMA_BASE_URL", DEFAULT_BASE_URL),
                parseTtl(dotenv, "CACHE_TTL_LOCALITIES", DEFAULT_TTL_LOCALITIES),
                parseTtl(dotenv, "CACHE_TTL_CLASSES", DEFAULT_TTL_CLASSES),
                parseTtl(dotenv, "CACHE_TTL_FORECAST", DEFAULT_TTL_FORECAST));
    }

    private static long parseTtl(Dotenv dotenv, String name, long defaultValue) {
        String raw = dotenv.get(name);
        if (raw == null || raw.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " должен быть целым числом секунд, получено: " + raw, e);
        }
    }

    private static void requireNonNegative(String name, long value) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " не может быть отрицательным: " + value);
        }
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public long getTtlLocalities() {
        return ttlLocalities;
    }

    public long getTtlClasses() {
        return ttlClasses;
    }

    public long getTtlForecast() {
        return ttlForecast;
    }

    @Override
    public String toString() {
        return "IpmaSettings{baseUrl='" + baseUrl + "', ttlLocalities=" + ttlLocalities
                + ", ttlClasses=" + ttlClasses + ", ttlForecast=" + ttlForecast + '}';
    }
}
