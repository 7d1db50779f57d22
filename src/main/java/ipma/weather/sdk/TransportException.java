package ipma.weather.sdk;

/**
 * Сервис IPMA недоступен: DNS, соединение, таймаут или нечитаемый ответ.
 */
public class TransportException extends WeatherException {
    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
