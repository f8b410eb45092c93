package com.riansoft.pickup_vrp.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.riansoft.pickup_vrp.config.RoutingProperties;
import com.riansoft.pickup_vrp.exception.UpstreamException;
import com.riansoft.pickup_vrp.model.GeoPoint;
import com.riansoft.pickup_vrp.model.RouteMatrixElement;
import com.riansoft.pickup_vrp.model.RoutingPreference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.web.client.MockServerRestTemplateCustomizer;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class GoogleRouteMatrixClientTest {

    private static final String MATRIX_URL = "https://routes.googleapis.com/distanceMatrix/v2:computeRouteMatrix";

    private static final List<GeoPoint> ORIGINS = List.of(new GeoPoint(35.681236, 139.767125), new GeoPoint(35.658034, 139.701636));
    private static final List<GeoPoint> DESTINATIONS = List.of(new GeoPoint(35.689592, 139.700413));

    private GoogleRouteMatrixClient client;
    private MockRestServiceServer server;

    @BeforeEach
    void setUp() {
        RoutingProperties properties = new RoutingProperties();
        properties.getGoogle().setApiKey("test-key");
        MockServerRestTemplateCustomizer customizer = new MockServerRestTemplateCustomizer();
        client = new GoogleRouteMatrixClient(new RestTemplateBuilder(customizer), new ObjectMapper(), properties);
        server = customizer.getServer();
    }

    @Test
    @DisplayName("키/필드 마스크 헤더와 waypoint 본문으로 POST하고 스트림 응답을 읽는다")
    void whenBlockRequested_thenPostsWaypointsAndParsesStream() {
        server.expect(requestTo(MATRIX_URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("X-Goog-Api-Key", "test-key"))
                .andExpect(header("X-Goog-FieldMask", GoogleRouteMatrixClient.FIELD_MASK))
                .andExpect(jsonPath("$.origins.length()").value(2))
                .andExpect(jsonPath("$.origins[1].waypoint.location.latLng.latitude").value(35.658034))
                .andExpect(jsonPath("$.destinations[0].waypoint.location.latLng.longitude").value(139.700413))
                .andExpect(jsonPath("$.travelMode").value("DRIVE"))
                .andExpect(jsonPath("$.routingPreference").value("TRAFFIC_AWARE"))
                .andExpect(jsonPath("$.departureTime").value("2025-10-20T08:00:00Z"))
                .andRespond(withSuccess(")]}'\n"
                        + "[\n"
                        + "{\"originIndex\":0,\"duration\":\"720s\",\"distanceMeters\":6100,\"condition\":\"ROUTE_EXISTS\"},\n"
                        + "{\"originIndex\":1,\"duration\":\"540s\",\"distanceMeters\":3800,\"condition\":\"ROUTE_EXISTS\"}\n"
                        + "]", MediaType.APPLICATION_JSON));

        List<RouteMatrixElement> elements = client.computeBlock(ORIGINS, DESTINATIONS,
                "2025-10-20T08:00:00Z", RoutingPreference.TRAFFIC_AWARE);

        server.verify();
        assertEquals(2, elements.size());
        assertEquals(1, elements.get(1).originIndex);
        assertEquals(0, elements.get(1).destinationIndex);
        assertEquals(540.0, elements.get(1).durationSeconds);
    }

    @Test
    @DisplayName("출발 시각이 없으면 departureTime 필드를 보내지 않는다")
    void whenNoDepartureTime_thenFieldOmitted() {
        server.expect(requestTo(MATRIX_URL))
                .andExpect(jsonPath("$.departureTime").doesNotExist())
                .andExpect(jsonPath("$.routingPreference").value("TRAFFIC_UNAWARE"))
                .andRespond(withSuccess("[]", MediaType.APPLICATION_JSON));

        List<RouteMatrixElement> elements = client.computeBlock(ORIGINS, DESTINATIONS, null, RoutingPreference.TRAFFIC_UNAWARE);

        server.verify();
        assertTrue(elements.isEmpty());
    }

    @Test
    @DisplayName("HTTP 오류는 상태 코드와 본문 일부를 담은 UpstreamException")
    void whenHttpError_thenUpstreamErrorWithSnippet() {
        server.expect(requestTo(MATRIX_URL))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"error\":{\"code\":429,\"status\":\"RESOURCE_EXHAUSTED\"}}"));
        server.expect(requestTo(MATRIX_URL))
                .andRespond(withStatus(HttpStatus.FORBIDDEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"error\":{\"code\":403,\"status\":\"PERMISSION_DENIED\"}}"));

        UpstreamException throttled = assertThrows(UpstreamException.class,
                () -> client.computeBlock(ORIGINS, DESTINATIONS, null, RoutingPreference.TRAFFIC_AWARE));
        UpstreamException denied = assertThrows(UpstreamException.class,
                () -> client.computeBlock(ORIGINS, DESTINATIONS, null, RoutingPreference.TRAFFIC_AWARE));

        assertTrue(throttled.getMessage().startsWith("Routes API HTTP 429: "));
        assertTrue(throttled.getMessage().contains("RESOURCE_EXHAUSTED"));
        assertTrue(throttled.isRetryable());
        assertTrue(denied.getMessage().contains("PERMISSION_DENIED"));
        assertFalse(denied.isRetryable());
    }

    @Test
    @DisplayName("200 응답 안의 error 객체도 UpstreamException")
    void whenErrorInsideSuccessBody_thenUpstreamError() {
        server.expect(requestTo(MATRIX_URL))
                .andRespond(withSuccess("[{\"error\":{\"code\":400,\"status\":\"INVALID_ARGUMENT\"}}]", MediaType.APPLICATION_JSON));

        assertThrows(UpstreamException.class,
                () -> client.computeBlock(ORIGINS, DESTINATIONS, null, RoutingPreference.TRAFFIC_AWARE));
    }
}
