package com.riansoft.pickup_vrp.dto;

public class RouteStopDto {
    private String stopId;
    private long loadAtStop;
    private long timeMinutes;

    public RouteStopDto() {}

    public RouteStopDto(String stopId, long loadAtStop, long timeMinutes) {
        this.stopId = stopId;
        this.loadAtStop = loadAtStop;
        this.timeMinutes = timeMinutes;
    }

    public String getStopId() { return stopId; }
    public void setStopId(String stopId) { this.stopId = stopId; }
    public long getLoadAtStop() { return loadAtStop; }
    public void setLoadAtStop(long loadAtStop) { this.loadAtStop = loadAtStop; }
    public long getTimeMinutes() { return timeMinutes; }
    public void setTimeMinutes(long timeMinutes) { this.timeMinutes = timeMinutes; }
}
