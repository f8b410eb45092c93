package com.riansoft.pickup_vrp.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.ArrayList;
import java.util.List;

public class SolveRoutesRequestDto {
    @NotEmpty
    @Valid
    private List<PointDto> points = new ArrayList<>();

    // points 기준 인덱스 쌍 [승차, 하차]
    @NotNull
    private List<List<Integer>> pickupDropPairs = new ArrayList<>();

    @Min(1)
    private int vehicleCount = 2;

    @Min(0)
    private int vehicleCapacity = 2;

    private String departureTime;
    private String routingPreference = "TRAFFIC_AWARE";

    // --- Getters and Setters ---
    public List<PointDto> getPoints() { return points; }
    public void setPoints(List<PointDto> points) { this.points = points; }
    public List<List<Integer>> getPickupDropPairs() { return pickupDropPairs; }
    public void setPickupDropPairs(List<List<Integer>> pickupDropPairs) { this.pickupDropPairs = pickupDropPairs; }
    public int getVehicleCount() { return vehicleCount; }
    public void setVehicleCount(int vehicleCount) { this.vehicleCount = vehicleCount; }
    public int getVehicleCapacity() { return vehicleCapacity; }
    public void setVehicleCapacity(int vehicleCapacity) { this.vehicleCapacity = vehicleCapacity; }
    public String getDepartureTime() { return departureTime; }
    public void setDepartureTime(String departureTime) { this.departureTime = departureTime; }
    public String getRoutingPreference() { return routingPreference; }
    public void setRoutingPreference(String routingPreference) { this.routingPreference = routingPreference; }
}
