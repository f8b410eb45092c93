package com.riansoft.pickup_vrp.client;

import com.riansoft.pickup_vrp.exception.ResolutionException;
import com.riansoft.pickup_vrp.model.GeoPoint;

/**
 * 주소 문자열을 좌표로 바꿉니다. 구현체는 캐시하지 않습니다.
 */
public interface GeocodingClient {

    /**
     * @throws ResolutionException 일치하는 주소가 없거나 제공자가 요청을 거부/응답하지 못한 경우
     */
    GeoPoint resolve(String address);
}
