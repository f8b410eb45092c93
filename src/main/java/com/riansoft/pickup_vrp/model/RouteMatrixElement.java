package com.riansoft.pickup_vrp.model;

/**
 * 블록 응답의 한 칸. 인덱스는 요청한 블록 기준이며, 제공자가 값을 안 보냈으면
 * {@code durationSeconds}, {@code distanceMeters}는 null입니다.
 */
public class RouteMatrixElement {
    public static final String ROUTE_EXISTS = "ROUTE_EXISTS";

    public final int originIndex;
    public final int destinationIndex;
    public final String condition;
    public final Double durationSeconds;
    public final Long distanceMeters;

    public RouteMatrixElement(int originIndex, int destinationIndex, String condition,
                              Double durationSeconds, Long distanceMeters) {
        this.originIndex = originIndex;
        this.destinationIndex = destinationIndex;
        this.condition = condition == null ? ROUTE_EXISTS : condition;
        this.durationSeconds = durationSeconds;
        this.distanceMeters = distanceMeters;
    }

    public boolean isRouted() {
        return ROUTE_EXISTS.equals(condition) && durationSeconds != null && distanceMeters != null;
    }
}
