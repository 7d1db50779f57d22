package ipma.weather.sdk.forecast;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import ipma.weather.sdk.model.DayForecastSummary;
import ipma.weather.sdk.model.WeatherTypeLabel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Приведение прогноза IPMA к единому виду.
 * IPMA присылает числа то строками, то числами; нераспознанные значения оставляются как есть.
 */
public final class ForecastNormalizer {
    private static final Logger log = LoggerFactory.getLogger(ForecastNormalizer.class);

    static final List<String> NUMERIC_FIELDS = List.of("tMin", "tMax", "precipitaProb", "latitude", "longitude");

    private ForecastNormalizer() {
    }

    /**
     * Возвращает копию документа, в которой числовые поля дней приведены к double.
     * Исходный документ (он же лежит в кэше) не меняется.
     */
    public static JsonNode normalize(JsonNode document) {
        JsonNode copy = document.deepCopy();
        for (JsonNode day : copy.path("data")) {
            if (!day.isObject()) {
                continue;
            }
            ObjectNode dayObject = (ObjectNode) day;
            for (String field : NUMERIC_FIELDS) {
                JsonNode value = dayObject.get(field);
                if (value == null || value.isNull()) {
                    continue;
                }
                Optional<Double> coerced = coerceDouble(value);
                if (coerced.isPresent()) {
                    dayObject.set(field, DoubleNode.valueOf(coerced.get()));
                } else {
                    log.debug("Поле {}={} не является числом, оставлено как есть", field, value);
                }
            }
        }
        return copy;
    }

    /** Число из числового или строкового узла JSON. */
    public static Optional<Double> coerceDouble(JsonNode value) {
        if (value == null || value.isNull()) {
            return Optional.empty();
        }
        if (value.isNumber()) {
            return Optional.of(value.asDouble());
        }
        if (value.isTextual()) {
            try {
                return Optional.of(Double.parseDouble(value.asText().trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * День прогноза с точным совпадением {@code forecastDate} (формат yyyy-MM-dd).
     */
    public static Optional<JsonNode> selectDay(JsonNode document, LocalDate date) {
        String target = date.toString();
        for (JsonNode day : document.path("data")) {
            if (target.equals(day.path("forecastDate").asText(null))) {
                return Optional.of(day);
            }
        }
        return Optional.empty();
    }

    /**
     * Собирает прогноз на день с подписями типа погоды.
     * Для неизвестного кода подписи пустые.
     */
    public static DayForecastSummary summarize(int globalIdLocal, JsonNode day, Map<Integer, WeatherTypeLabel> labels) {
        DayForecastSummary summary = new DayForecastSummary();
        summary.globalIdLocal = globalIdLocal;
        summary.forecastDate = day.path("forecastDate").asText();
        summary.tMin = coerceDouble(day.get("tMin")).orElse(null);
        summary.tMax = coerceDouble(day.get("tMax")).orElse(null);
        summary.precipitaProb = coerceDouble(day.get("precipitaProb")).orElse(null);
        summary.predWindDir = textOrNull(day.get("predWindDir"));

        summary.weather = new DayForecastSummary.Weather();
        summary.weather.id = intOrNull(day.get("idWeatherType"));
        WeatherTypeLabel label = summary.weather.id == null
                ? WeatherTypeLabel.EMPTY
                : labels.getOrDefault(summary.weather.id, WeatherTypeLabel.EMPTY);
        summary.weather.pt = label.pt;
        summary.weather.en = label.en;

        summary.wind = new DayForecastSummary.Wind();
        summary.wind.windClass = intOrNull(day.get("classWindSpeed"));
        summary.wind.dir = summary.predWindDir;
        return summary;
    }

    private static Integer intOrNull(JsonNode value) {
        return coerceDouble(value).map(Double::intValue).orElse(null);
    }

    private static String textOrNull(JsonNode value) {
        return value == null || value.isNull() ? null : value.asText();
    }
}
