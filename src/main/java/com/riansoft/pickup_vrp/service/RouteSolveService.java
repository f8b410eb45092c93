package com.riansoft.pickup_vrp.service;

import com.riansoft.pickup_vrp.config.RoutingProperties;
import com.riansoft.pickup_vrp.dto.PointDto;
import com.riansoft.pickup_vrp.dto.RouteSolutionDto;
import com.riansoft.pickup_vrp.dto.SolveRoutesRequestDto;
import com.riansoft.pickup_vrp.exception.InvalidInputException;
import com.riansoft.pickup_vrp.model.GeoPoint;
import com.riansoft.pickup_vrp.model.PickupDropPair;
import com.riansoft.pickup_vrp.model.RoutePlan;
import com.riansoft.pickup_vrp.model.RoutingPreference;
import com.riansoft.pickup_vrp.model.Stop;
import com.riansoft.pickup_vrp.model.TravelMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * API 요청 하나를 처리합니다: 행렬 생성 → 경로 최적화 → 응답 변환.
 */
@Service
public class RouteSolveService {

    private static final Logger log = LoggerFactory.getLogger(RouteSolveService.class);

    private final MatrixService matrixService;
    private final RouteOptimizationService routeOptimizationService;
    private final SolutionFormatterService solutionFormatterService;
    private final RoutingProperties properties;

    @Autowired
    public RouteSolveService(MatrixService matrixService, RouteOptimizationService routeOptimizationService,
                             SolutionFormatterService solutionFormatterService, RoutingProperties properties) {
        this.matrixService = matrixService;
        this.routeOptimizationService = routeOptimizationService;
        this.solutionFormatterService = solutionFormatterService;
        this.properties = properties;
    }

    public RouteSolutionDto solveRoutes(SolveRoutesRequestDto request) {
        log.info("========= [1/3] 경로 계산 요청 수신 (정류장 {}개, 승하차 쌍 {}개) ==========",
                request.getPoints().size(), request.getPickupDropPairs().size());
        List<Stop> stops = toStops(request.getPoints());
        List<PickupDropPair> pairs = toPairs(request.getPickupDropPairs());
        RoutingPreference preference = parsePreference(request.getRoutingPreference());

        log.info("========= [2/3] 시간 행렬 생성 ==========");
        TravelMatrix matrix = matrixService.build(stops, request.getDepartureTime(), preference, false);

        log.info("========= [3/3] 경로 최적화 ==========");
        List<RoutePlan> plans = routeOptimizationService.solve(matrix.getIds(), matrix.getMinutes(), pairs,
                request.getVehicleCount(), request.getVehicleCapacity(), properties.toSolverSettings());
        return solutionFormatterService.toDto(plans);
    }

    private List<Stop> toStops(List<PointDto> points) {
        List<Stop> stops = new ArrayList<>(points.size());
        for (PointDto point : points) {
            GeoPoint coordinate = null;
            if (point.getLat() != null && point.getLng() != null) {
                coordinate = new GeoPoint(point.getLat(), point.getLng());
            }
            stops.add(new Stop(point.getId(), coordinate, point.getAddress()));
        }
        return stops;
    }

    private List<PickupDropPair> toPairs(List<List<Integer>> rawPairs) {
        List<PickupDropPair> pairs = new ArrayList<>(rawPairs.size());
        for (List<Integer> raw : rawPairs) {
            if (raw == null || raw.size() != 2 || raw.get(0) == null || raw.get(1) == null) {
                throw new InvalidInputException("Each pickup/drop pair needs exactly two indices, got " + raw);
            }
            pairs.add(new PickupDropPair(raw.get(0), raw.get(1)));
        }
        return pairs;
    }

    private RoutingPreference parsePreference(String raw) {
        if (raw == null || raw.isBlank()) {
            return RoutingPreference.TRAFFIC_AWARE;
        }
        try {
            return RoutingPreference.valueOf(raw.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException("Unknown routingPreference: " + raw);
        }
    }
}
