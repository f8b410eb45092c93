package com.riansoft.pickup_vrp.model;

public enum RoutingPreference {
    TRAFFIC_AWARE,
    TRAFFIC_UNAWARE
}
