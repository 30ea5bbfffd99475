package com.riansoft.delivery_dispatch.model;

import java.util.List;
import java.util.Set;

public class RoundResult {
    public final int round;
    // only vehicles with at least one stop
    public final List<VehicleTrip> trips;
    public final Set<Integer> newlyServed;
    public final int totalServedAfterRound;
    public final double distance;

    public RoundResult(int round, List<VehicleTrip> trips, Set<Integer> newlyServed, int totalServedAfterRound) {
        this.round = round;
        this.trips = List.copyOf(trips);
        this.newlyServed = Set.copyOf(newlyServed);
        this.totalServedAfterRound = totalServedAfterRound;
        this.distance = trips.stream().mapToDouble(trip -> trip.distance).sum();
    }
}
