package ipma.weather.sdk.forecast;

/**
 * Что прогнозировать: явный {@code globalIdLocal} или название локации с необязательным округом.
 */
public final class ForecastQuery {
    private final Integer globalIdLocal;
    private final String locality;
    private final Integer districtId;

    private ForecastQuery(Integer globalIdLocal, String locality, Integer districtId) {
        if (globalIdLocal == null && (locality == null || locality.trim().isEmpty())) {
            throw new IllegalArgumentException("Укажите globalIdLocal или название локации");
        }
        this.globalIdLocal = globalIdLocal;
        this.locality = locality;
        this.districtId = districtId;
    }

    public static ForecastQuery byId(int globalIdLocal) {
        return new ForecastQuery(globalIdLocal, null, null);
    }

    public static ForecastQuery byName(String locality) {
        return new ForecastQuery(null, locality, null);
    }

    public static ForecastQuery byName(String locality, Integer districtId) {
        return new ForecastQuery(null, locality, districtId);
    }

    /** Любое сочетание параметров; id, если задан, имеет приоритет над названием. */
    public static ForecastQuery of(Integer globalIdLocal, String locality, Integer districtId) {
        return new ForecastQuery(globalIdLocal, locality, districtId);
    }

    public Integer getGlobalIdLocal() {
        return globalIdLocal;
    }

    public String getLocality() {
        return locality;
    }

    public Integer getDistrictId() {
        return districtId;
    }

    @Override
    public String toString() {
        return globalIdLocal != null
                ? "ForecastQuery{globalIdLocal=" + globalIdLocal + '}'
                : "ForecastQuery{locality='" + locality + "', districtId=" + districtId + '}';
    }
}
