package ipma.weather.sdk.http;

import com.fasterxml.jackson.databind.JsonNode;
import ipma.weather.sdk.TransportException;
import ipma.weather.sdk.UpstreamStatusException;

/**
 * Получение JSON-документа по URL.
 */
@FunctionalInterface
public interface JsonFetcher {

    /**
     * @throws TransportException      сетевая ошибка, таймаут или тело не является JSON
     * @throws UpstreamStatusException ответ со статусом вне 2xx
     */
    JsonNode fetchJson(String url) throws TransportException, UpstreamStatusException;
}
