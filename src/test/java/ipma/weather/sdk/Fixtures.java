package ipma.weather.sdk;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Ответы IPMA для тестов.
 */
public final class Fixtures {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Fixtures() {
    }

    public static JsonNode json(String text) {
        try {
            return MAPPER.readTree(text);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static final String LOCALITIES = """
            {
              "owner": "IPMA",
              "country": "PT",
              "data": [
                {"idRegiao": 1, "idAreaAviso": "PTO", "idConcelho": 1, "globalIdLocal": 10,
                 "latitude": "41.1580", "idDistrito": 13, "local": "Porto", "longitude": "-8.6294"},
                {"idRegiao": 3, "idAreaAviso": "MPS", "idConcelho": 2, "globalIdLocal": 20,
                 "latitude": "33.0700", "idDistrito": 32, "local": "Porto Santo", "longitude": "-16.3400"},
                {"idRegiao": 1, "idAreaAviso": "FAR", "idConcelho": 5, "globalIdLocal": 30,
                 "latitude": "37.1000", "idDistrito": 8, "local": "Lagoa", "longitude": "-8.4500"},
                {"idRegiao": 2, "idAreaAviso": "AOR", "idConcelho": 3, "globalIdLocal": 31,
                 "latitude": "37.7400", "idDistrito": 42, "local": "Lagoa", "longitude": "-25.5700"},
                {"idRegiao": 1, "idAreaAviso": "AVR", "globalIdLocal": 40,
                 "latitude": "40.6400", "idDistrito": 1, "local": "Vila Nova", "longitude": "-8.6500"},
                {"idRegiao": 1, "idAreaAviso": "AVR", "idConcelho": 9, "globalIdLocal": 41,
                 "latitude": "40.6500", "idDistrito": 1, "local": "Vila Nova", "longitude": "-8.6600"},
                {"idRegiao": 1, "idAreaAviso": "LSB", "idConcelho": 6, "globalIdLocal": 1110600,
                 "latitude": "38.7660", "idDistrito": 11, "local": "Lisboa", "longitude": "-9.1286"}
              ]
            }""";

    public static final String WEATHER_TYPES = """
            {
              "owner": "IPMA",
              "country": "PT",
              "data": [
                {"descWeatherTypeEN": "Clear sky", "descWeatherTypePT": "Céu limpo", "idWeatherType": 1},
                {"descWeatherTypeEN": "Partly cloudy", "descWeatherTypePT": "Céu pouco nublado", "idWeatherType": 2},
                {"descWeatherTypeEN": "Light rain", "descWeatherTypePT": "Chuva fraca ou chuvisco", "idWeatherType": "9"}
              ]
            }""";

    public static final String FORECAST_LISBOA = """
            {
              "owner": "IPMA",
              "country": "PT",
              "data": [
                {"precipitaProb": "0.0", "tMin": "16.2", "tMax": "28.4", "predWindDir": "NW",
                 "idWeatherType": 1, "classWindSpeed": 2, "longitude": "-9.1286",
                 "forecastDate": "2025-06-01", "latitude": "38.7660"},
                {"precipitaProb": "75.0", "tMin": 14, "tMax": "n/a", "predWindDir": "SW",
                 "idWeatherType": 9, "classWindSpeed": "3", "longitude": "-9.1286",
                 "forecastDate": "2025-06-02", "latitude": "38.7660"},
                {"precipitaProb": null, "tMin": "15.0", "tMax": "22.1", "predWindDir": "N",
                 "idWeatherType": 27, "longitude": "-9.1286",
                 "forecastDate": "2025-06-03", "latitude": "38.7660"}
              ],
              "globalIdLocal": 1110600,
              "dataUpdate": "2025-06-01T10:31:02"
            }""";
}
