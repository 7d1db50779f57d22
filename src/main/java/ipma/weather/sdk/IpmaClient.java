package ipma.weather.sdk;

import com.fasterxml.jackson.databind.JsonNode;
import ipma.weather.sdk.cache.TtlCache;
import ipma.weather.sdk.http.JsonFetcher;
import ipma.weather.sdk.http.OkHttpJsonFetcher;
import ipma.weather.sdk.model.Locality;
import ipma.weather.sdk.model.WeatherTypeLabel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Клиент открытых данных IPMA — выполняет запросы, кэширует, ищет локации.
 * <p>
 * Каждый класс ресурсов (локации, типы погоды, прогнозы) хранится в собственном
 * {@link TtlCache} со своим TTL. Одновременные промахи по одному ключу не объединяются:
 * оба вызова пойдут в IPMA, в кэше останется результат последнего.
 */
public class IpmaClient implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(IpmaClient.class);

    static final String LOCALITIES_KEY = "localities";
    static final String WEATHER_TYPES_KEY = "weather_types";
    static final String FORECAST_KEY_PREFIX = "forecast:";

    // записи без idConcelho/globalIdLocal сортируются последними
    private static final int MISSING_ID_SENTINEL = 1_000_000;

    private static final Comparator<Locality> TIE_BREAK = Comparator
            .comparingInt((Locality l) -> l.idConcelho != null ? l.idConcelho : MISSING_ID_SENTINEL)
            .thenComparingInt(l -> l.globalIdLocal != null ? l.globalIdLocal : MISSING_ID_SENTINEL);

    private final String baseUrl;
    private final JsonFetcher fetcher;
    private final TtlCache<List<Locality>> localitiesCache;
    private final TtlCache<Map<Integer, WeatherTypeLabel>> weatherTypesCache;
    private final TtlCache<JsonNode> forecastCache;

    public IpmaClient(IpmaSettings settings) {
        this(settings, new OkHttpJsonFetcher(), Clock.systemUTC());
    }

    public IpmaClient(IpmaSettings settings, JsonFetcher fetcher) {
        this(settings, fetcher, Clock.systemUTC());
    }

    public IpmaClient(IpmaSettings settings, JsonFetcher fetcher, Clock clock) {
        this.baseUrl = settings.getBaseUrl();
        this.fetcher = fetcher;
        this.localitiesCache = new TtlCache<>(LOCALITIES_KEY, settings.getTtlLocalities(), clock);
        this.weatherTypesCache = new TtlCache<>(WEATHER_TYPES_KEY, settings.getTtlClasses(), clock);
        this.forecastCache = new TtlCache<>("forecast", settings.getTtlForecast(), clock);
        log.debug("IpmaClient создан: {}", settings);
    }

    /**
     * Справочник локаций из {@code {base}/distrits-islands.json}.
     */
    public List<Locality> getLocalities() throws WeatherException {
        Optional<List<Locality>> cached = localitiesCache.get(LOCALITIES_KEY);
        if (cached.isPresent()) {
            log.debug("Локации взяты из кэша");
            return cached.get();
        }

        JsonNode root = fetcher.fetchJson(baseUrl + "/distrits-islands.json");
        List<Locality> items = new ArrayList<>();
        for (JsonNode node : root.path("data")) {
            items.add(Locality.fromJson(node));
        }
        List<Locality> localities = Collections.unmodifiableList(items);
        localitiesCache.set(LOCALITIES_KEY, localities);
        log.info("Загружено локаций: {}", localities.size());
        return localities;
    }

    /**
     * Подписи типов погоды: {@code idWeatherType -> {pt, en}}.
     * В кэше хранится уже построенная карта, а не исходный массив.
     */
    public Map<Integer, WeatherTypeLabel> getWeatherTypes() throws WeatherException {
        Optional<Map<Integer, WeatherTypeLabel>> cached = weatherTypesCache.get(WEATHER_TYPES_KEY);
        if (cached.isPresent()) {
            log.debug("Типы погоды взяты из кэша");
            return cached.get();
        }

        JsonNode root = fetcher.fetchJson(baseUrl + "/weather-type-classe.json");
        Map<Integer, WeatherTypeLabel> mapping = new HashMap<>();
        for (JsonNode item : root.path("data")) {
            JsonNode id = item.get("idWeatherType");
            if (id == null || id.isNull()) {
                log.warn("Тип погоды без idWeatherType пропущен: {}", item);
                continue;
            }
            mapping.put(id.asInt(), new WeatherTypeLabel(
                    item.path("descWeatherTypePT").asText(""),
                    item.path("descWeatherTypeEN").asText("")));
        }
        Map<Integer, WeatherTypeLabel> labels = Collections.unmodifiableMap(mapping);
        weatherTypesCache.set(WEATHER_TYPES_KEY, labels);
        log.info("Загружено типов погоды: {}", labels.size());
        return labels;
    }

    /**
     * Прогноз на несколько дней для локации, документ IPMA без изменений.
     * Возвращаемое дерево общее с кэшем, изменять его нельзя.
     */
    public JsonNode getDailyForecast(int globalIdLocal) throws WeatherException {
        String cacheKey = FORECAST_KEY_PREFIX + globalIdLocal;
        Optional<JsonNode> cached = forecastCache.get(cacheKey);
        if (cached.isPresent()) {
            log.debug("Прогноз {} взят из кэша", globalIdLocal);
            return cached.get();
        }

        JsonNode data = fetcher.fetchJson(baseUrl + "/forecast/meteorology/cities/daily/" + globalIdLocal + ".json");
        forecastCache.set(cacheKey, data);
        return data;
    }

    /**
     * Ищет локацию по названию без учёта регистра.
     * Сначала точное совпадение, затем вхождение подстроки; при {@code districtId} оба
     * поиска ограничены округом. Среди нескольких кандидатов выбирается наименьшая пара
     * {@code (idConcelho, globalIdLocal)}.
     *
     * @return запись локации или пустой результат, если ничего не найдено
     */
    public Optional<Locality> findLocality(String name, Integer districtId) throws WeatherException {
        if (name == null) {
            throw new IllegalArgumentException("Название локации не может быть null");
        }
        List<Locality> localities = getLocalities();
        String normalized = name.trim().toLowerCase(Locale.ROOT);

        Optional<Locality> exact = pick(localities, l -> l.normalizedName().equals(normalized), districtId);
        if (exact.isPresent()) {
            return exact;
        }
        Optional<Locality> partial = pick(localities, l -> l.normalizedName().contains(normalized), districtId);
        if (partial.isEmpty()) {
            log.debug("Локация '{}' (округ {}) не найдена", name, districtId);
        }
        return partial;
    }

    public Optional<Locality> findLocality(String name) throws WeatherException {
        return findLocality(name, null);
    }

    /**
     * Фильтр справочника по подстроке названия и округу, порядок IPMA сохраняется.
     * Пустой {@code query} не фильтрует.
     */
    public List<Locality> searchLocalities(String query, Integer districtId) throws WeatherException {
        String normalized = query == null ? "" : query.trim().toLowerCase(Locale.ROOT);
        return getLocalities().stream()
                .filter(l -> normalized.isEmpty() || l.normalizedName().contains(normalized))
                .filter(l -> districtId == null || districtId.equals(l.idDistrito))
                .collect(Collectors.toList());
    }

    /** Сбрасывает все три кэша. */
    public void clearCaches() {
        localitiesCache.clear();
        weatherTypesCache.clear();
        forecastCache.clear();
        log.info("Кэши IpmaClient очищены");
    }

    private static Optional<Locality> pick(List<Locality> localities, Predicate<Locality> match, Integer districtId) {
        return localities.stream()
                .filter(match)
                .filter(l -> districtId == null || districtId.equals(l.idDistrito))
                .min(TIE_BREAK);
    }

    @Override
    public void close() {
        if (fetcher instanceof AutoCloseable) {
            try {
                ((AutoCloseable) fetcher).close();
            } catch (Exception e) {
                log.warn("Не удалось закрыть HTTP-клиент: {}", e.getMessage(), e);
            }
        }
    }
}
