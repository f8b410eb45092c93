package com.riansoft.pickup_vrp.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.riansoft.pickup_vrp.config.RoutingProperties;
import com.riansoft.pickup_vrp.exception.ResolutionException;
import com.riansoft.pickup_vrp.model.GeoPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Duration;
import java.util.Set;

/**
 * Google Geocoding API 클라이언트. 주소 하나당 GET 한 번이며, 언어/지역 힌트는 설정값을 씁니다.
 */
@Component
public class GoogleGeocodingClient implements GeocodingClient {

    private static final Logger log = LoggerFactory.getLogger(GoogleGeocodingClient.class);

    private static final Set<String> RETRYABLE_STATUSES = Set.of("OVER_QUERY_LIMIT", "UNKNOWN_ERROR");

    private final RestTemplate restTemplate;
    private final RoutingProperties.Google google;

    public GoogleGeocodingClient(RestTemplateBuilder builder, RoutingProperties properties) {
        this.google = properties.getGoogle();
        this.restTemplate = builder
                .setConnectTimeout(Duration.ofSeconds(google.getConnectTimeoutSeconds()))
                .setReadTimeout(Duration.ofSeconds(google.getReadTimeoutSeconds()))
                .build();
    }

    @Override
    public GeoPoint resolve(String address) {
        URI uri = UriComponentsBuilder.fromHttpUrl(google.getGeocodeUrl())
                .queryParam("address", address)
                .queryParam("key", google.requireApiKey())
                .queryParam("language", google.getLanguage())
                .queryParam("region", google.getRegion())
                .encode()
                .build()
                .toUri();

        log.info("[GEOCODE] 주소 좌표 변환 요청: '{}'", address);
        JsonNode body;
        try {
            body = restTemplate.getForObject(uri, JsonNode.class);
        } catch (HttpStatusCodeException e) {
            int code = e.getStatusCode().value();
            boolean retryable = e.getStatusCode().is5xxServerError() || code == 429;
            log.warn("[GEOCODE] '{}' 변환 실패: HTTP {}", address, code);
            throw new ResolutionException(address, "HTTP " + code, retryable,
                    "Geocode failed: " + address + " -> HTTP " + code, e);
        } catch (ResourceAccessException e) {
            log.warn("[GEOCODE] '{}' 변환 실패: 서버 연결 불가 ({})", address, e.getMessage());
            throw new ResolutionException(address, "UNREACHABLE", true,
                    "Geocode failed: " + address + " -> provider unreachable", e);
        } catch (RestClientException e) {
            throw new ResolutionException(address, "UNREADABLE", false,
                    "Geocode failed: " + address + " -> unreadable response", e);
        }

        String status = body == null ? "EMPTY" : body.path("status").asText("MISSING");
        JsonNode results = body == null ? null : body.path("results");
        if (!"OK".equals(status) || results == null || !results.isArray() || results.isEmpty()) {
            log.warn("[GEOCODE] '{}' 변환 실패: {}", address, status);
            throw new ResolutionException(address, status, RETRYABLE_STATUSES.contains(status),
                    "Geocode failed: " + address + " -> " + status);
        }

        JsonNode location = results.get(0).path("geometry").path("location");
        if (!location.hasNonNull("lat") || !location.hasNonNull("lng")) {
            throw new ResolutionException(address, status, false,
                    "Geocode failed: " + address + " -> result without location");
        }
        GeoPoint point = new GeoPoint(location.get("lat").asDouble(), location.get("lng").asDouble());
        log.debug("[GEOCODE] '{}' -> {}", address, point);
        return point;
    }
}
