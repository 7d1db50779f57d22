package ipma.weather.sdk.forecast;

import com.fasterxml.jackson.databind.JsonNode;
import ipma.weather.sdk.IpmaClient;
import ipma.weather.sdk.WeatherException;
import ipma.weather.sdk.model.DayForecastSummary;
import ipma.weather.sdk.model.Locality;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Прогнозы по запросу пользователя: разрешает локацию, берёт прогноз из клиента и нормализует его.
 * Ошибки сети и статуса IPMA пробрасываются как есть; "не найдено" возвращается через {@link Lookup}.
 */
public class ForecastService {
    private static final Logger log = LoggerFactory.getLogger(ForecastService.class);

    private final IpmaClient client;

    public ForecastService(IpmaClient client) {
        this.client = client;
    }

    public Lookup<Integer> resolve(ForecastQuery query) throws WeatherException {
        if (query.getGlobalIdLocal() != null) {
            return Lookup.found(query.getGlobalIdLocal());
        }
        Optional<Locality> found = client.findLocality(query.getLocality(), query.getDistrictId());
        if (found.isEmpty() || found.get().globalIdLocal == null) {
            log.info("Локация не найдена: {}", query);
            return Lookup.localityNotFound();
        }
        return Lookup.found(found.get().globalIdLocal);
    }

    /** Прогноз на все доступные дни с числовыми полями, приведёнными к double. */
    public Lookup<JsonNode> dailyForecast(ForecastQuery query) throws WeatherException {
        Lookup<Integer> id = resolve(query);
        if (!id.isFound()) {
            return id.absentAs();
        }
        return Lookup.found(ForecastNormalizer.normalize(client.getDailyForecast(id.value())));
    }

    /** Прогноз на один день; дата должна входить в окно прогноза IPMA. */
    public Lookup<DayForecastSummary> dayForecast(ForecastQuery query, LocalDate date) throws WeatherException {
        Lookup<Integer> id = resolve(query);
        if (!id.isFound()) {
            return id.absentAs();
        }
        JsonNode document = client.getDailyForecast(id.value());
        Optional<JsonNode> day = ForecastNormalizer.selectDay(document, date);
        if (day.isEmpty()) {
            log.info("Дата {} вне окна прогноза для {}", date, id.value());
            return Lookup.dateNotAvailable();
        }
        int globalIdLocal = document.hasNonNull("globalIdLocal")
                ? document.get("globalIdLocal").asInt()
                : id.value();
        return Lookup.found(ForecastNormalizer.summarize(globalIdLocal, day.get(), client.getWeatherTypes()));
    }
}
