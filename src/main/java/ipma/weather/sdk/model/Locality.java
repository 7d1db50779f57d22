package ipma.weather.sdk.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;
import java.util.Objects;

/**
 * Справочная запись о локации IPMA (столицы округов, острова).
 * {@code globalIdLocal} используется как ключ для запросов прогноза.
 * Целочисленные поля могут отсутствовать в ответе и тогда равны {@code null}.
 */
public class Locality {
    public final Integer globalIdLocal;
    public final String local;
    public final Integer idRegiao;
    public final Integer idDistrito;
    public final Integer idConcelho;
    public final String idAreaAviso;
    public final String latitude;
    public final String longitude;

    public Locality(Integer globalIdLocal, String local, Integer idRegiao, Integer idDistrito,
                    Integer idConcelho, String idAreaAviso, String latitude, String longitude) {
        this.globalIdLocal = globalIdLocal;
        this.local = local;
        this.idRegiao = idRegiao;
        this.idDistrito = idDistrito;
        this.idConcelho = idConcelho;
        this.idAreaAviso = idAreaAviso;
        this.latitude = latitude;
        this.longitude = longitude;
    }

    public static Locality fromJson(JsonNode node) {
        return new Locality(
                intOrNull(node, "globalIdLocal"),
                textOrNull(node, "local"),
                intOrNull(node, "idRegiao"),
                intOrNull(node, "idDistrito"),
                intOrNull(node, "idConcelho"),
                textOrNull(node, "idAreaAviso"),
                textOrNull(node, "latitude"),
                textOrNull(node, "longitude"));
    }

    /** Название в нижнем регистре, пустая строка если поле отсутствует. */
    public String normalizedName() {
        return local == null ? "" : local.toLowerCase(Locale.ROOT);
    }

    private static Integer intOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.canConvertToInt()) {
            return value.asInt();
        }
        if (value.isTextual()) {
            try {
                return Integer.parseInt(value.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Locality)) return false;
        Locality that = (Locality) o;
        return Objects.equals(globalIdLocal, that.globalIdLocal)
                && Objects.equals(local, that.local)
                && Objects.equals(idRegiao, that.idRegiao)
                && Objects.equals(idDistrito, that.idDistrito)
                && Objects.equals(idConcelho, that.idConcelho)
                && Objects.equals(idAreaAviso, that.idAreaAviso)
                && Objects.equals(latitude, that.latitude)
                && Objects.equals(longitude, that.longitude);
    }

    @Override
    public int hashCode() {
        return Objects.hash(globalIdLocal, local, idRegiao, idDistrito, idConcelho, idAreaAviso, latitude, longitude);
    }

    @Override
    public String toString() {
        return "Locality{" + globalIdLocal + ", '" + local + "', distrito=" + idDistrito
                + ", concelho=" + idConcelho + '}';
    }
}
