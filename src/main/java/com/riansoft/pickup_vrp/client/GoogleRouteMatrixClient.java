package com.riansoft.pickup_vrp.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.riansoft.pickup_vrp.config.RoutingProperties;
import com.riansoft.pickup_vrp.exception.UpstreamException;
import com.riansoft.pickup_vrp.model.GeoPoint;
import com.riansoft.pickup_vrp.model.RouteMatrixElement;
import com.riansoft.pickup_vrp.model.RoutingPreference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.List;

/**
 * Routes API {@code computeRouteMatrix} 클라이언트. 출발지/도착지 블록 하나당 POST 한 번.
 */
@Component
public class GoogleRouteMatrixClient implements RouteMatrixClient {

    private static final Logger log = LoggerFactory.getLogger(GoogleRouteMatrixClient.class);

    static final String FIELD_MASK = "originIndex,destinationIndex,duration,distanceMeters,condition";
    private static final int SNIPPET_LENGTH = 400;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final RouteMatrixResponseParser parser;
    private final RoutingProperties.Google google;

    public GoogleRouteMatrixClient(RestTemplateBuilder builder, ObjectMapper objectMapper, RoutingProperties properties) {
        this.google = properties.getGoogle();
        this.objectMapper = objectMapper;
        this.parser = new RouteMatrixResponseParser(objectMapper);
        this.restTemplate = builder
                .setConnectTimeout(Duration.ofSeconds(google.getConnectTimeoutSeconds()))
                .setReadTimeout(Duration.ofSeconds(google.getReadTimeoutSeconds()))
                .build();
    }

    @Override
    public List<RouteMatrixElement> computeBlock(List<GeoPoint> origins, List<GeoPoint> destinations,
                                                 String departureTime, RoutingPreference routingPreference) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("X-Goog-Api-Key", google.requireApiKey());
        headers.set("X-Goog-FieldMask", FIELD_MASK);
        HttpEntity<String> entity = new HttpEntity<>(requestBody(origins, destinations, departureTime, routingPreference), headers);

        log.debug("[MATRIX API] 블록 요청: {} origins x {} destinations ({})",
                origins.size(), destinations.size(), routingPreference);
        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(google.getRouteMatrixUrl(), HttpMethod.POST, entity, String.class);
        } catch (HttpStatusCodeException e) {
            int code = e.getStatusCode().value();
            boolean retryable = e.getStatusCode().is5xxServerError() || code == 429;
            log.warn("[MATRIX API] Routes API 응답 오류: HTTP {}", code);
            throw new UpstreamException("Routes API HTTP " + code + ": " + snippet(e.getResponseBodyAsString()), retryable, e);
        } catch (ResourceAccessException e) {
            log.warn("[MATRIX API] Routes API 연결 불가: {}", e.getMessage());
            throw new UpstreamException("Routes API unreachable: " + e.getMessage(), true, e);
        } catch (RestClientException e) {
            throw new UpstreamException("Routes API call failed: " + e.getMessage(), false, e);
        }
        return parser.parse(response.getBody());
    }

    String requestBody(List<GeoPoint> origins, List<GeoPoint> destinations,
                       String departureTime, RoutingPreference routingPreference) {
        ObjectNode body = objectMapper.createObjectNode();
        waypoints(body.putArray("origins"), origins);
        waypoints(body.putArray("destinations"), destinations);
        body.put("travelMode", google.getTravelMode());
        body.put("routingPreference", routingPreference.name());
        if (departureTime != null) {
            body.put("departureTime", departureTime);
        }
        return body.toString();
    }

    private void waypoints(ArrayNode target, List<GeoPoint> points) {
        for (GeoPoint point : points) {
            ObjectNode latLng = target.addObject()
                    .putObject("waypoint")
                    .putObject("location")
                    .putObject("latLng");
            latLng.put("latitude", point.lat);
            latLng.put("longitude", point.lng);
        }
    }

    private static String snippet(String text) {
        if (text == null) return "";
        return text.length() <= SNIPPET_LENGTH ? text : text.substring(0, SNIPPET_LENGTH);
    }
}
