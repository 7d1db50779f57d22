package ipma.weather.sdk.model;

import java.util.Objects;

/**
 * Подписи типа погоды на португальском и английском.
 */
public class WeatherTypeLabel {
    public static final WeatherTypeLabel EMPTY = new WeatherTypeLabel("", "");

    public final String pt;
    public final String en;

    public WeatherTypeLabel(String pt, String en) {
        this.pt = pt == null ? "" : pt;
        this.en = en == null ? "" : en;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WeatherTypeLabel)) return false;
        WeatherTypeLabel that = (WeatherTypeLabel) o;
        return pt.equals(that.pt) && en.equals(that.en);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pt, en);
    }

    @Override
    public String toString() {
        return pt + " / " + en;
    }
}
