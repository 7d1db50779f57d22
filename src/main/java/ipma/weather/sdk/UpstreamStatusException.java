package ipma.weather.sdk;

/**
 * Сервис IPMA ответил статусом вне диапазона 2xx.
 */
public class UpstreamStatusException extends WeatherException {
    private final int statusCode;
    private final String url;

    public UpstreamStatusException(int statusCode, String url) {
        super("IPMA API error [" + statusCode + "]: " + url);
        this.statusCode = statusCode;
        this.url = url;
    }

    public int statusCode() {
        return statusCode;
    }

    public String url() {
        return url;
    }
}
