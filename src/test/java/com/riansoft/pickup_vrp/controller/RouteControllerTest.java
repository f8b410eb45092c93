package com.riansoft.pickup_vrp.controller;

import com.riansoft.pickup_vrp.dto.RouteSolutionDto;
import com.riansoft.pickup_vrp.dto.RouteStopDto;
import com.riansoft.pickup_vrp.dto.SolveRoutesRequestDto;
import com.riansoft.pickup_vrp.dto.VehicleRouteDto;
import com.riansoft.pickup_vrp.exception.InfeasibleException;
import com.riansoft.pickup_vrp.exception.InvalidInputException;
import com.riansoft.pickup_vrp.exception.ResolutionException;
import com.riansoft.pickup_vrp.exception.UpstreamException;
import com.riansoft.pickup_vrp.service.RouteSolveService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(RouteController.class)
class RouteControllerTest {

    private static final String BODY = "{"
            + "\"points\":["
            + "{\"id\":\"DEPOT\",\"lat\":35.681236,\"lng\":139.767125},"
            + "{\"id\":\"R001_P\",\"address\":\"東京都渋谷区道玄坂2-24-1\"},"
            + "{\"id\":\"R001_D\",\"lat\":35.689592,\"lng\":139.692006}],"
            + "\"pickupDropPairs\":[[1,2]],"
            + "\"vehicleCount\":1,"
            + "\"vehicleCapacity\":2"
            + "}";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RouteSolveService routeSolveService;

    @Test
    @DisplayName("GET / 는 상태 메시지를 돌려준다")
    void whenRootRequested_thenRunningMessage() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("API is running"));
    }

    @Test
    @DisplayName("정상 요청은 200과 경로 목록")
    void whenSolved_thenRoutesReturned() throws Exception {
        RouteSolutionDto solution = new RouteSolutionDto("ok", List.of(new VehicleRouteDto(0, List.of(
                new RouteStopDto("DEPOT", 0, 0),
                new RouteStopDto("R001_P", 1, 9),
                new RouteStopDto("R001_D", 0, 21),
                new RouteStopDto("DEPOT", 0, 32)), 32, 1)));
        when(routeSolveService.solveRoutes(any())).thenReturn(solution);

        mockMvc.perform(post("/api/solve-routes").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.routes[0].vehicleId").value(0))
                .andExpect(jsonPath("$.routes[0].stops[1].stopId").value("R001_P"))
                .andExpect(jsonPath("$.routes[0].stops[1].loadAtStop").value(1))
                .andExpect(jsonPath("$.routes[0].totalTravelTimeMinutes").value(32))
                .andExpect(jsonPath("$.routes[0].maxLoad").value(1));

        verify(routeSolveService).solveRoutes(argThat((SolveRoutesRequestDto request) ->
                request.getPoints().size() == 3
                        && "TRAFFIC_AWARE".equals(request.getRoutingPreference())
                        && request.getPoints().get(1).getLat() == null));
    }

    @Test
    @DisplayName("points가 비었거나 vehicleCount가 0이면 서비스 호출 없이 400")
    void whenBodyViolatesConstraints_thenBadRequest() throws Exception {
        mockMvc.perform(post("/api/solve-routes").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"points\":[],\"pickupDropPairs\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("error"))
                .andExpect(jsonPath("$.code").value("INVALID_INPUT"));
        mockMvc.perform(post("/api/solve-routes").contentType(MediaType.APPLICATION_JSON)
                        .content(BODY.replace("\"vehicleCount\":1", "\"vehicleCount\":0")))
                .andExpect(status().isBadRequest());
        mockMvc.perform(post("/api/solve-routes").contentType(MediaType.APPLICATION_JSON).content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_INPUT"));

        verify(routeSolveService, never()).solveRoutes(any());
    }

    @Test
    @DisplayName("InvalidInputException은 400")
    void whenInvalidInput_thenBadRequest() throws Exception {
        when(routeSolveService.solveRoutes(any())).thenThrow(new InvalidInputException("Duplicate stop id: DEPOT"));

        mockMvc.perform(post("/api/solve-routes").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_INPUT"))
                .andExpect(jsonPath("$.message").value("Duplicate stop id: DEPOT"));
    }

    @Test
    @DisplayName("주소 변환 실패는 재시도 불가면 400, 재시도 가능이면 502")
    void whenResolutionFails_thenStatusDependsOnRetryable() throws Exception {
        when(routeSolveService.solveRoutes(any()))
                .thenThrow(new ResolutionException("x", "ZERO_RESULTS", false, "Geocode failed: x -> ZERO_RESULTS"))
                .thenThrow(new ResolutionException("x", "OVER_QUERY_LIMIT", true, "Geocode failed: x -> OVER_QUERY_LIMIT"));

        mockMvc.perform(post("/api/solve-routes").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("RESOLUTION_FAILED"))
                .andExpect(jsonPath("$.message").value("Geocode failed: x -> ZERO_RESULTS"));
        mockMvc.perform(post("/api/solve-routes").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.code").value("RESOLUTION_FAILED"));
    }

    @Test
    @DisplayName("행렬 API 실패는 502, 해 없음은 422, 그 외는 500")
    void whenDownstreamFails_thenMappedStatus() throws Exception {
        when(routeSolveService.solveRoutes(any()))
                .thenThrow(new UpstreamException("Routes API HTTP 403: denied", false))
                .thenThrow(new InfeasibleException("No feasible route found", "ROUTING_FAIL"))
                .thenThrow(new IllegalStateException("Google Maps API key is not set"));

        mockMvc.perform(post("/api/solve-routes").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.code").value("UPSTREAM_FAILED"));
        mockMvc.perform(post("/api/solve-routes").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("INFEASIBLE"));
        mockMvc.perform(post("/api/solve-routes").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("INTERNAL_ERROR"))
                .andExpect(jsonPath("$.message").value(RouteController.INTERNAL_ERROR_MESSAGE));
    }
}
