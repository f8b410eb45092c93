package com.riansoft.pickup_vrp.client;

import com.riansoft.pickup_vrp.exception.UpstreamException;
import com.riansoft.pickup_vrp.model.GeoPoint;
import com.riansoft.pickup_vrp.model.RouteMatrixElement;
import com.riansoft.pickup_vrp.model.RoutingPreference;

import java.util.List;

/**
 * 출발지 블록 x 도착지 블록의 이동 시간/거리를 가져옵니다.
 * 결과의 인덱스는 넘겨준 목록 기준이며, 제공자가 빠뜨린 칸은 결과에도 없습니다.
 */
public interface RouteMatrixClient {

    /**
     * @param departureTime ISO-8601 시각. null이면 제공자 기본값
     * @throws UpstreamException 블록 요청이 거부되거나 응답을 읽을 수 없는 경우
     */
    List<RouteMatrixElement> computeBlock(List<GeoPoint> origins, List<GeoPoint> destinations,
                                          String departureTime, RoutingPreference routingPreference);
}
