package com.riansoft.pickup_vrp.service;

import com.google.ortools.constraintsolver.Assignment;
import com.google.ortools.constraintsolver.RoutingDimension;
import com.google.ortools.constraintsolver.RoutingIndexManager;
import com.google.ortools.constraintsolver.RoutingModel;
import com.riansoft.pickup_vrp.dto.RouteSolutionDto;
import com.riansoft.pickup_vrp.dto.RouteStopDto;
import com.riansoft.pickup_vrp.dto.VehicleRouteDto;
import com.riansoft.pickup_vrp.model.DataModel;
import com.riansoft.pickup_vrp.model.RoutePlan;
import com.riansoft.pickup_vrp.model.RouteVisit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class SolutionFormatterService {

    private static final Logger log = LoggerFactory.getLogger(SolutionFormatterService.class);

    /**
     * OR-Tools 해에서 차량별 경로를 꺼냅니다. 차고지 출발부터 복귀 노드까지 모든 방문에 대해
     * 누적 시간과 적재량을 기록합니다. 운행하지 않는 차량도 출발→복귀 두 방문짜리 경로로 포함됩니다.
     */
    public List<RoutePlan> extractRoutes(DataModel data, RoutingIndexManager manager, RoutingModel routing,
                                         Assignment solution) {
        RoutingDimension timeDimension = routing.getDimensionOrDie(RouteOptimizationService.TIME_DIMENSION);
        RoutingDimension capacityDimension = routing.getDimensionOrDie(RouteOptimizationService.CAPACITY_DIMENSION);

        List<RoutePlan> plans = new ArrayList<>(data.numVehicles);
        for (int vehicle = 0; vehicle < data.numVehicles; ++vehicle) {
            List<RouteVisit> visits = new ArrayList<>();
            long maxLoad = 0;
            long index = routing.start(vehicle);
            while (true) {
                int nodeIndex = manager.indexToNode(index);
                long load = solution.value(capacityDimension.cumulVar(index));
                // 대기(slack) 때문에 시간은 범위로 남을 수 있어 가장 이른 도착 시각을 씀
                long time = solution.min(timeDimension.cumulVar(index));
                maxLoad = Math.max(maxLoad, load);
                visits.add(new RouteVisit(data.stopIds.get(nodeIndex), time, load));
                if (routing.isEnd(index)) {
                    break;
                }
                index = solution.value(routing.nextVar(index));
            }

            long totalTime = visits.get(visits.size() - 1).cumulativeTimeMinutes;
            RoutePlan plan = new RoutePlan(vehicle, visits, totalTime, maxLoad);
            if (!plan.isIdle()) {
                log.info("  차량 #{}: {} (총 {}분, 최대 적재 {}/{})", vehicle, visits, totalTime, maxLoad,
                        data.vehicleCapacities[vehicle]);
            }
            plans.add(plan);
        }
        return plans;
    }

    public RouteSolutionDto toDto(List<RoutePlan> plans) {
        List<VehicleRouteDto> routes = new ArrayList<>(plans.size());
        for (RoutePlan plan : plans) {
            List<RouteStopDto> stops = new ArrayList<>(plan.visits.size());
            for (RouteVisit visit : plan.visits) {
                stops.add(new RouteStopDto(visit.stopId, visit.loadAfterStop, visit.cumulativeTimeMinutes));
            }
            routes.add(new VehicleRouteDto(plan.vehicleId, stops, plan.totalTravelTimeMinutes, plan.maxLoad));
        }
        return new RouteSolutionDto("ok", routes);
    }
}
