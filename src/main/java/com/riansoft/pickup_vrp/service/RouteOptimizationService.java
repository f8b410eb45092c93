package com.riansoft.pickup_vrp.service;

import com.google.ortools.Loader;
import com.google.ortools.constraintsolver.Assignment;
import com.google.ortools.constraintsolver.FirstSolutionStrategy;
import com.google.ortools.constraintsolver.LocalSearchMetaheuristic;
import com.google.ortools.constraintsolver.RoutingDimension;
import com.google.ortools.constraintsolver.RoutingIndexManager;
import com.google.ortools.constraintsolver.RoutingModel;
import com.google.ortools.constraintsolver.RoutingSearchParameters;
import com.google.ortools.constraintsolver.Solver;
import com.google.ortools.constraintsolver.main;
import com.google.protobuf.Duration;
import com.riansoft.pickup_vrp.exception.InfeasibleException;
import com.riansoft.pickup_vrp.model.DataModel;
import com.riansoft.pickup_vrp.model.PickupDropPair;
import com.riansoft.pickup_vrp.model.RoutePlan;
import com.riansoft.pickup_vrp.model.SolverSettings;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 승하차 쌍이 있는 다중 차량 경로 문제(PDP)를 OR-Tools 라우팅 솔버로 풉니다.
 *
 * <ul>
 *   <li>Time 차원: 이동 시간 누적, 정류장별 대기 허용(slack), 경로 전체 상한(horizon)</li>
 *   <li>Capacity 차원: 승차 +1, 하차 -1, 누적 적재량은 [0, 정원]</li>
 *   <li>승하차 쌍: 같은 차량, 승차 시각 ≤ 하차 시각</li>
 * </ul>
 * 목적 함수는 전체 차량의 이동 시간 합입니다. PATH_CHEAPEST_ARC로 초기 해를 만들고
 * GUIDED_LOCAL_SEARCH로 시간 예산이 끝날 때까지 개선합니다.
 */
@Service
public class RouteOptimizationService {

    private static final Logger log = LoggerFactory.getLogger(RouteOptimizationService.class);

    static final String TIME_DIMENSION = "Time";
    static final String CAPACITY_DIMENSION = "Capacity";

    private final RouteValidationService validationService;
    private final SolutionFormatterService solutionFormatterService;

    @Autowired
    public RouteOptimizationService(RouteValidationService validationService,
                                    SolutionFormatterService solutionFormatterService) {
        this.validationService = validationService;
        this.solutionFormatterService = solutionFormatterService;
    }

    @PostConstruct
    public void init() {
        try {
            log.info("[LOG] Google OR-Tools 네이티브 라이브러리 로드를 시도합니다...");
            Loader.loadNativeLibraries();
            log.info("[LOG] 라이브러리 로드 성공!");
        } catch (RuntimeException | LinkageError e) {
            log.error("!!! [FATAL] Google OR-Tools 라이브러리 로드 실패 !!!", e);
            throw new IllegalStateException("OR-Tools native libraries could not be loaded", e);
        }
    }

    public List<RoutePlan> solve(List<String> stopIds, long[][] minutes, List<PickupDropPair> pairs,
                                 int vehicleCount, long vehicleCapacity, SolverSettings settings) {
        return solve(stopIds, minutes, pairs, vehicleCount, vehicleCapacity, 0, settings);
    }

    public List<RoutePlan> solve(List<String> stopIds, long[][] minutes, List<PickupDropPair> pairs,
                                 int vehicleCount, long vehicleCapacity, int depotIndex, SolverSettings settings) {
        validationService.validateSolveInput(stopIds, minutes, pairs, vehicleCount, vehicleCapacity, depotIndex);
        DataModel data = new DataModel(minutes, stopIds, pairs, vehicleCount, vehicleCapacity, depotIndex);
        return runSolver(data, settings);
    }

    private List<RoutePlan> runSolver(DataModel data, SolverSettings settings) {
        log.info("========= [SOLVER] OR-Tools 모델 생성 및 제약조건 설정 시작 (정류장 {}개, 쌍 {}개, 차량 {}대, 정원 {}) ==========",
                data.stopIds.size(), data.pairs.size(), data.numVehicles, data.vehicleCapacities[0]);
        RoutingIndexManager manager = new RoutingIndexManager(data.timeMatrix.length, data.numVehicles, data.depotIndex);
        RoutingModel routing = new RoutingModel(manager);

        final int transitCallbackIndex = routing.registerTransitCallback(
                (long fromIndex, long toIndex) -> {
                    int fromNode = manager.indexToNode(fromIndex);
                    int toNode = manager.indexToNode(toIndex);
                    return data.timeMatrix[fromNode][toNode];
                });
        routing.setArcCostEvaluatorOfAllVehicles(transitCallbackIndex);

        routing.addDimension(transitCallbackIndex, settings.slackMinutes, settings.horizonMinutes, true, TIME_DIMENSION);
        RoutingDimension timeDimension = routing.getDimensionOrDie(TIME_DIMENSION);

        final int demandCallbackIndex = routing.registerUnaryTransitCallback(
                (long fromIndex) -> data.demands[manager.indexToNode(fromIndex)]);
        routing.addDimensionWithVehicleCapacity(demandCallbackIndex, 0, data.vehicleCapacities, true, CAPACITY_DIMENSION);

        Solver solver = routing.solver();
        for (PickupDropPair pair : data.pairs) {
            long pickupIndex = manager.nodeToIndex(pair.pickupIndex);
            long dropIndex = manager.nodeToIndex(pair.dropIndex);
            routing.addPickupAndDelivery(pickupIndex, dropIndex);
            solver.addConstraint(solver.makeEquality(routing.vehicleVar(pickupIndex), routing.vehicleVar(dropIndex)));
            solver.addConstraint(solver.makeLessOrEqual(timeDimension.cumulVar(pickupIndex), timeDimension.cumulVar(dropIndex)));
        }

        log.info("========= [SOLVER] 경로 최적화 계산 시작 (최대 {}초) ==========", settings.searchTimeBudgetSeconds);
        RoutingSearchParameters searchParameters = main.defaultRoutingSearchParameters().toBuilder()
                .setFirstSolutionStrategy(FirstSolutionStrategy.Value.PATH_CHEAPEST_ARC)
                .setLocalSearchMetaheuristic(LocalSearchMetaheuristic.Value.GUIDED_LOCAL_SEARCH)
                .setTimeLimit(Duration.newBuilder().setSeconds(settings.searchTimeBudgetSeconds).build())
                .build();

        Assignment solution = routing.solveWithParameters(searchParameters);

        if (solution == null) {
            String status = String.valueOf(routing.status());
            log.warn("!!! [SOLVER] 최적 경로 계산 실패 (Solver Status: {}) !!!", status);
            throw new InfeasibleException("No feasible route found for " + data.pairs.size() + " pairs with "
                    + data.numVehicles + " vehicle(s) of capacity " + data.vehicleCapacities[0]
                    + " within " + settings.horizonMinutes + " minutes", status);
        }
        log.info("[SOLVER] 최적 경로 계산 성공! 총 이동 시간 {}분", solution.objectiveValue());
        return solutionFormatterService.extractRoutes(data, manager, routing, solution);
    }
}
