package ipma.weather.sdk.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import ipma.weather.sdk.TransportException;
import ipma.weather.sdk.UpstreamStatusException;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Реализация {@link JsonFetcher} на OkHttp с общим таймаутом 20 секунд на запрос.
 */
public class OkHttpJsonFetcher implements JsonFetcher, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(OkHttpJsonFetcher.class);

    static final long CALL_TIMEOUT_SECONDS = 20;

    private final OkHttpClient client;
    private final ObjectMapper mapper;

    public OkHttpJsonFetcher() {
        this(new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(CALL_TIMEOUT_SECONDS, TimeUnit.SECONDS)
                .callTimeout(CALL_TIMEOUT_SECONDS, TimeUnit.SECONDS)
                .build(), new ObjectMapper());
    }

    public OkHttpJsonFetcher(OkHttpClient client, ObjectMapper mapper) {
        this.client = client;
        this.mapper = mapper;
    }

    @Override
    public JsonNode fetchJson(String url) throws TransportException, UpstreamStatusException {
        Request request = new Request.Builder()
                .url(url)
                .header("Accept", "application/json")
                .build();

        log.info("Запрос к IPMA: {}", url);
        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                log.warn("IPMA ответил статусом {} для {}", response.code(), url);
                throw new UpstreamStatusException(response.code(), url);
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new TransportException("Пустое тело ответа от IPMA: " + url, null);
            }
            return mapper.readTree(body.string());
        } catch (IOException e) {
            log.warn("Ошибка сети при запросе к {}: {}", url, e.getMessage());
            throw new TransportException("Ошибка сети при запросе к IPMA: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        client.dispatcher().executorService().shutdown();
        try {
            if (!client.dispatcher().executorService().awaitTermination(1, TimeUnit.SECONDS)) {
                client.dispatcher().executorService().shutdownNow();
            }
        } catch (InterruptedException e) {
            client.dispatcher().executorService().shutdownNow();
            Thread.currentThread().interrupt();
        }
        client.connectionPool().evictAll();
    }
}
