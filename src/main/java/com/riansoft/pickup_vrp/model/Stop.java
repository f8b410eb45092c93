package com.riansoft.pickup_vrp.model;

/**
 * 요청으로 받은 정류장. 행렬을 만들려면 {@code coordinate}나 {@code address} 중 하나는 있어야 합니다.
 */
public class Stop {
    public final String id;
    public final GeoPoint coordinate;
    public final String address;

    public Stop(String id, GeoPoint coordinate, String address) {
        this.id = id;
        this.coordinate = coordinate;
        this.address = address;
    }

    public static Stop at(String id, double lat, double lng) {
        return new Stop(id, new GeoPoint(lat, lng), null);
    }

    public static Stop atAddress(String id, String address) {
        return new Stop(id, null, address);
    }

    public boolean hasAddress() {
        return address != null && !address.isBlank();
    }
}
