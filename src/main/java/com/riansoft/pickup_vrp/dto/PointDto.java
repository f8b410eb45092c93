package com.riansoft.pickup_vrp.dto;

import jakarta.validation.constraints.NotBlank;

// 요청의 정류장 하나. 좌표(lat, lng) 또는 주소 중 하나는 있어야 함
public class PointDto {
    @NotBlank
    private String id;
    private Double lat;
    private Double lng;
    private String address;

    public PointDto() {}

    public PointDto(String id, Double lat, Double lng, String address) {
        this.id = id;
        this.lat = lat;
        this.lng = lng;
        this.address = address;
    }

    // --- Getters and Setters ---
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public Double getLat() { return lat; }
    public void setLat(Double lat) { this.lat = lat; }
    public Double getLng() { return lng; }
    public void setLng(Double lng) { this.lng = lng; }
    public String getAddress() { return address; }
    public void setAddress(String address) { this.address = address; }
}
