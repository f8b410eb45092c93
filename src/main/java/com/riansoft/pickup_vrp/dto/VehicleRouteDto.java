package com.riansoft.pickup_vrp.dto;

import java.util.List;

public class VehicleRouteDto {
    private int vehicleId;
    private List<RouteStopDto> stops;
    private long totalTravelTimeMinutes;
    private long maxLoad;

    public VehicleRouteDto() {}

    public VehicleRouteDto(int vehicleId, List<RouteStopDto> stops, long totalTravelTimeMinutes, long maxLoad) {
        this.vehicleId = vehicleId;
        this.stops = stops;
        this.totalTravelTimeMinutes = totalTravelTimeMinutes;
        this.maxLoad = maxLoad;
    }

    // --- Getters and Setters ---
    public int getVehicleId() { return vehicleId; }
    public void setVehicleId(int vehicleId) { this.vehicleId = vehicleId; }
    public List<RouteStopDto> getStops() { return stops; }
    public void setStops(List<RouteStopDto> stops) { this.stops = stops; }
    public long getTotalTravelTimeMinutes() { return totalTravelTimeMinutes; }
    public void setTotalTravelTimeMinutes(long totalTravelTimeMinutes) { this.totalTravelTimeMinutes = totalTravelTimeMinutes; }
    public long getMaxLoad() { return maxLoad; }
    public void setMaxLoad(long maxLoad) { this.maxLoad = maxLoad; }
}
