package com.riansoft.pickup_vrp.model;

public class RouteVisit {
    public final String stopId;
    public final long cumulativeTimeMinutes;
    public final long loadAfterStop;

    public RouteVisit(String stopId, long cumulativeTimeMinutes, long loadAfterStop) {
        this.stopId = stopId;
        this.cumulativeTimeMinutes = cumulativeTimeMinutes;
        this.loadAfterStop = loadAfterStop;
    }

    @Override
    public String toString() {
        return stopId + "@" + cumulativeTimeMinutes + "min/" + loadAfterStop;
    }
}
