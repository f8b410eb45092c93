package com.riansoft.pickup_vrp.model;

public class PickupDropPair {
    public final int pickupIndex;
    public final int dropIndex;

    public PickupDropPair(int pickupIndex, int dropIndex) {
        this.pickupIndex = pickupIndex;
        this.dropIndex = dropIndex;
    }

    @Override
    public String toString() {
        return "(" + pickupIndex + ", " + dropIndex + ")";
    }
}
