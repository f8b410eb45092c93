package com.riansoft.pickup_vrp.config;

import com.riansoft.pickup_vrp.model.SolverSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * {@code routing.*} 설정 (solver / matrix / google)
 */
@ConfigurationProperties(prefix = "routing")
public class RoutingProperties {

    private final Solver solver = new Solver();
    private final Matrix matrix = new Matrix();
    private final Google google = new Google();

    public Solver getSolver() { return solver; }
    public Matrix getMatrix() { return matrix; }
    public Google getGoogle() { return google; }

    public SolverSettings toSolverSettings() {
        return new SolverSettings(solver.slackMinutes, solver.horizonMinutes, solver.searchTimeBudgetSeconds);
    }

    public static class Solver {
        /** 정류장마다 허용되는 대기 시간(분) */
        private long slackMinutes = 30;
        /** 경로 하나의 최대 소요 시간(분) */
        private long horizonMinutes = 1440;
        private long searchTimeBudgetSeconds = 10;

        public long getSlackMinutes() { return slackMinutes; }
        public void setSlackMinutes(long slackMinutes) { this.slackMinutes = slackMinutes; }
        public long getHorizonMinutes() { return horizonMinutes; }
        public void setHorizonMinutes(long horizonMinutes) { this.horizonMinutes = horizonMinutes; }
        public long getSearchTimeBudgetSeconds() { return searchTimeBudgetSeconds; }
        public void setSearchTimeBudgetSeconds(long searchTimeBudgetSeconds) { this.searchTimeBudgetSeconds = searchTimeBudgetSeconds; }
    }

    public static class Matrix {
        /** 요청 한 번에 넣는 출발지(도착지) 수 */
        private int batchSize = 100;
        private int maxConcurrentBlocks = 4;
        private int cacheCapacity = 256;

        public int getBatchSize() { return batchSize; }
        public void setBatchSize(int batchSize) { this.batchSize = batchSize; }
        public int getMaxConcurrentBlocks() { return maxConcurrentBlocks; }
        public void setMaxConcurrentBlocks(int maxConcurrentBlocks) { this.maxConcurrentBlocks = maxConcurrentBlocks; }
        public int getCacheCapacity() { return cacheCapacity; }
        public void setCacheCapacity(int cacheCapacity) { this.cacheCapacity = cacheCapacity; }
    }

    public static class Google {
        private String apiKey = "";
        private String geocodeUrl = "https://maps.googleapis.com/maps/api/geocode/json";
        private String routeMatrixUrl = "https://routes.googleapis.com/distanceMatrix/v2:computeRouteMatrix";
        private String language = "ja";
        private String region = "JP";
        private String travelMode = "DRIVE";
        private long connectTimeoutSeconds = 20;
        private long readTimeoutSeconds = 90;

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
        public String getGeocodeUrl() { return geocodeUrl; }
        public void setGeocodeUrl(String geocodeUrl) { this.geocodeUrl = geocodeUrl; }
        public String getRouteMatrixUrl() { return routeMatrixUrl; }
        public void setRouteMatrixUrl(String routeMatrixUrl) { this.routeMatrixUrl = routeMatrixUrl; }
        public String getLanguage() { return language; }
        public void setLanguage(String language) { this.language = language; }
        public String getRegion() { return region; }
        public void setRegion(String region) { this.region = region; }
        public String getTravelMode() { return travelMode; }
        public void setTravelMode(String travelMode) { this.travelMode = travelMode; }
        public long getConnectTimeoutSeconds() { return connectTimeoutSeconds; }
        public void setConnectTimeoutSeconds(long connectTimeoutSeconds) { this.connectTimeoutSeconds = connectTimeoutSeconds; }
        public long getReadTimeoutSeconds() { return readTimeoutSeconds; }
        public void setReadTimeoutSeconds(long readTimeoutSeconds) { this.readTimeoutSeconds = readTimeoutSeconds; }

        /** 키가 없으면 호출 시점에 실패. 키 값은 로그에 남기지 않음 */
        public String requireApiKey() {
            if (apiKey == null || apiKey.isBlank()) {
                throw new IllegalStateException("Google Maps API key is not set (routing.google.api-key / GOOGLE_MAPS_API_KEY)");
            }
            return apiKey.trim();
        }
    }
}
