package ipma.weather.sdk.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Нормализованный прогноз на один день с расшифровкой типа погоды и ветра.
 * Числовые поля равны {@code null}, если IPMA не прислал число.
 */
public class DayForecastSummary {
    public int globalIdLocal;
    public String forecastDate;
    public Double tMin;
    public Double tMax;
    public Double precipitaProb;
    public String predWindDir;
    public Weather weather;
    public Wind wind;

    public static class Weather {
        public Integer id;
        public String pt;
        public String en;
    }

    public static class Wind {
        @JsonProperty("class")
        public Integer windClass;
        public String dir;
    }
}
