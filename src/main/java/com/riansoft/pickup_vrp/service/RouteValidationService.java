package com.riansoft.pickup_vrp.service;

import com.riansoft.pickup_vrp.exception.InvalidInputException;
import com.riansoft.pickup_vrp.model.PickupDropPair;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 솔버에 넘기기 전에 요청 값을 검사합니다. 여기서 걸러지는 오류는 모두 InvalidInputException이며
 * 재시도 대상이 아닙니다.
 *
 * <p>정원 0은 여기서 막지 않습니다. 승하차 쌍이 있을 때만 의미가 없는 값이므로 솔버가
 * 해를 찾지 못하는 것(InfeasibleException)으로 처리합니다.</p>
 */
@Service
public class RouteValidationService {

    public void validateSolveInput(List<String> stopIds, long[][] minutes, List<PickupDropPair> pairs,
                                   int vehicleCount, long vehicleCapacity, int depotIndex) {
        if (stopIds == null || stopIds.isEmpty()) {
            throw new InvalidInputException("Stop id list is empty");
        }
        int n = stopIds.size();
        Set<String> seen = new HashSet<>();
        for (String id : stopIds) {
            if (id == null || !seen.add(id)) {
                throw new InvalidInputException("Stop ids must be present and unique, offending id: " + id);
            }
        }
        if (depotIndex < 0 || depotIndex >= n) {
            throw new InvalidInputException("Depot index " + depotIndex + " is outside 0.." + (n - 1));
        }
        if (vehicleCount < 1) {
            throw new InvalidInputException("vehicleCount must be at least 1, got " + vehicleCount);
        }
        if (vehicleCapacity < 0) {
            throw new InvalidInputException("vehicleCapacity must not be negative, got " + vehicleCapacity);
        }
        validateMatrix(minutes, n);
        validatePairs(stopIds, pairs, depotIndex);
    }

    private void validateMatrix(long[][] minutes, int n) {
        if (minutes == null || minutes.length != n) {
            throw new InvalidInputException("Time matrix must have " + n + " rows, one per stop");
        }
        for (int i = 0; i < n; i++) {
            if (minutes[i] == null || minutes[i].length != n) {
                throw new InvalidInputException("Time matrix row " + i + " must have " + n + " columns");
            }
            for (int j = 0; j < n; j++) {
                if (minutes[i][j] < 0) {
                    throw new InvalidInputException("Time matrix entry [" + i + "][" + j + "] is negative: " + minutes[i][j]);
                }
            }
        }
    }

    private void validatePairs(List<String> stopIds, List<PickupDropPair> pairs, int depotIndex) {
        if (pairs == null) {
            throw new InvalidInputException("pickupDropPairs must not be null");
        }
        int n = stopIds.size();
        // 한 정류장은 쌍 하나에만 속할 수 있음 (수요 +1/-1이 겹치지 않도록)
        Map<Integer, PickupDropPair> owner = new HashMap<>();
        for (PickupDropPair pair : pairs) {
            if (pair == null) {
                throw new InvalidInputException("pickupDropPairs contains a null pair");
            }
            if (pair.pickupIndex < 0 || pair.pickupIndex >= n || pair.dropIndex < 0 || pair.dropIndex >= n) {
                throw new InvalidInputException("Pair " + pair + " references a stop outside 0.." + (n - 1));
            }
            if (pair.pickupIndex == pair.dropIndex) {
                throw new InvalidInputException("Pair " + pair + " picks up and drops at the same stop "
                        + stopIds.get(pair.pickupIndex));
            }
            if (pair.pickupIndex == depotIndex || pair.dropIndex == depotIndex) {
                throw new InvalidInputException("Pair " + pair + " uses the depot " + stopIds.get(depotIndex));
            }
            for (int index : new int[]{pair.pickupIndex, pair.dropIndex}) {
                PickupDropPair previous = owner.putIfAbsent(index, pair);
                if (previous != null) {
                    throw new InvalidInputException("Stop " + stopIds.get(index) + " is booked by both "
                            + previous + " and " + pair);
                }
            }
        }
    }
}
