package ipma.weather.sdk.examples;

import ipma.weather.sdk.IpmaClient;
import ipma.weather.sdk.IpmaSettings;
import ipma.weather.sdk.WeatherException;
import ipma.weather.sdk.forecast.ForecastQuery;
import ipma.weather.sdk.forecast.ForecastService;
import ipma.weather.sdk.forecast.Lookup;
import ipma.weather.sdk.model.DayForecastSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;

/**
 * Пример использования клиента IPMA.
 * Аргументы: название локации и необязательный id округа.
 */
public class ExampleUsage {
    private static final Logger log = LoggerFactory.getLogger(ExampleUsage.class);

    public static void main(String[] args) {
        String locality = args.length > 0 ? args[0] : "Lisboa";
        Integer districtId = args.length > 1 ? Integer.valueOf(args[1]) : null;

        IpmaSettings settings = IpmaSettings.fromEnvironment();
        log.info("Настройки: {}", settings);

        try (IpmaClient client = new IpmaClient(settings)) {
            ForecastService forecasts = new ForecastService(client);
            ForecastQuery query = ForecastQuery.byName(locality, districtId);

            printDay(forecasts, query, LocalDate.now());
            log.info("Повторный запрос (кэш):");
            printDay(forecasts, query, LocalDate.now());
        } catch (WeatherException e) {
            log.error("Ошибка при получении прогноза для {}: {}", locality, e.getMessage(), e);
        }
    }

    private static void printDay(ForecastService forecasts, ForecastQuery query, LocalDate date) throws WeatherException {
        Lookup<DayForecastSummary> result = forecasts.dayForecast(query, date);
        switch (result.outcome()) {
            case LOCALITY_NOT_FOUND:
                log.warn("Локация не найдена: {}", query);
                return;
            case DATE_NOT_AVAILABLE:
                log.warn("Нет прогноза на {}", date);
                return;
            default:
                break;
        }
        DayForecastSummary day = result.value();
        log.info("Локация: {}, дата: {}", day.globalIdLocal, day.forecastDate);
        log.info("Погода: {} ({})", day.weather.pt, day.weather.en);
        log.info("Температура: от {} до {}°C, вероятность осадков: {}%", day.tMin, day.tMax, day.precipitaProb);
        log.info("Ветер: класс {}, направление {}", day.wind.windClass, day.wind.dir);
    }
}
