package com.riansoft.pickup_vrp.dto;

import java.util.List;

public class RouteSolutionDto {

    private String status;
    private List<VehicleRouteDto> routes;

    // 1. 기본 생성자
    public RouteSolutionDto() {}

    // 2. SolutionFormatterService에서 최종 결과를 담을 때 사용하는 생성자
    public RouteSolutionDto(String status, List<VehicleRouteDto> routes) {
        this.status = status;
        this.routes = routes;
    }

    // --- Getters and Setters ---
    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }
    public List<VehicleRouteDto> getRoutes() { return routes; }
    public void setRoutes(List<VehicleRouteDto> routes) { this.routes = routes; }
}
