package ipma.weather.sdk.forecast;

import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Результат поиска: значение либо причина, по которой его нет.
 */
public final class Lookup<T> {

    public enum Outcome {
        FOUND,
        LOCALITY_NOT_FOUND,
        DATE_NOT_AVAILABLE
    }

    private final Outcome outcome;
    private final T value;

    private Lookup(Outcome outcome, T value) {
        this.outcome = outcome;
        this.value = value;
    }

    public static <T> Lookup<T> found(T value) {
        return new Lookup<>(Outcome.FOUND, Objects.requireNonNull(value, "value"));
    }

    public static <T> Lookup<T> localityNotFound() {
        return new Lookup<>(Outcome.LOCALITY_NOT_FOUND, null);
    }

    public static <T> Lookup<T> dateNotAvailable() {
        return new Lookup<>(Outcome.DATE_NOT_AVAILABLE, null);
    }

    /** Переносит причину отсутствия на результат другого типа. */
    <R> Lookup<R> absentAs() {
        if (outcome == Outcome.FOUND) {
            throw new IllegalStateException("Результат найден, переносить нечего");
        }
        return new Lookup<>(outcome, null);
    }

    public Outcome outcome() {
        return outcome;
    }

    public boolean isFound() {
        return outcome == Outcome.FOUND;
    }

    public T value() {
        if (outcome != Outcome.FOUND) {
            throw new NoSuchElementException("Нет значения: " + outcome);
        }
        return value;
    }

    @Override
    public String toString() {
        return outcome == Outcome.FOUND ? "Lookup[" + value + "]" : "Lookup[" + outcome + "]";
    }
}
