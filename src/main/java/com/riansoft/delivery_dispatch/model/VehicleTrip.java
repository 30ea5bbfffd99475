package com.riansoft.delivery_dispatch.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * What one vehicle delivers in one round.
 */
public class VehicleTrip {
    public final int vehicleId;
    public final int round;
    public final List<TripStop> stops;
    public final long load;
    public final double distance;

    public VehicleTrip(int vehicleId, int round, List<TripStop> stops, long load, double distance) {
        this.vehicleId = vehicleId;
        this.round = round;
        this.stops = List.copyOf(stops);
        this.load = load;
        this.distance = distance;
    }

    public List<Integer> servedNodeIds() {
        return stops.stream().map(stop -> stop.nodeId).collect(Collectors.toList());
    }
}
