package com.riansoft.pickup_vrp.model;

import java.util.List;

public class DataModel {
    public final long[][] timeMatrix;
    public final List<String> stopIds;
    public final List<PickupDropPair> pairs;
    public final int numVehicles;
    public final long[] vehicleCapacities;
    public final long[] demands;
    public final int depotIndex;

    public DataModel(long[][] timeMatrix, List<String> stopIds, List<PickupDropPair> pairs,
                     int numVehicles, long capacity, int depotIndex) {
        this.timeMatrix = timeMatrix;
        this.stopIds = List.copyOf(stopIds);
        this.pairs = List.copyOf(pairs);
        this.numVehicles = numVehicles;
        this.depotIndex = depotIndex;

        this.vehicleCapacities = new long[numVehicles];
        for (int i = 0; i < numVehicles; i++) {
            vehicleCapacities[i] = capacity;
        }

        // 승차 +1, 하차 -1, 나머지 0
        this.demands = new long[stopIds.size()];
        for (PickupDropPair pair : pairs) {
            demands[pair.pickupIndex] = 1;
            demands[pair.dropIndex] = -1;
        }
    }
}
