package com.riansoft.pickup_vrp.model;

import java.util.List;

public class RoutePlan {
    public final int vehicleId;
    public final List<RouteVisit> visits;
    public final long totalTravelTimeMinutes;
    public final long maxLoad;

    public RoutePlan(int vehicleId, List<RouteVisit> visits, long totalTravelTimeMinutes, long maxLoad) {
        this.vehicleId = vehicleId;
        this.visits = List.copyOf(visits);
        this.totalTravelTimeMinutes = totalTravelTimeMinutes;
        this.maxLoad = maxLoad;
    }

    /** 차고지를 나갔다가 바로 돌아오는 차량 */
    public boolean isIdle() {
        return visits.size() <= 2;
    }
}
