package com.riansoft.delivery_dispatch.model;

public class TripStop {
    public final int nodeId;
    public final long demand;
    // vehicle load after delivering here
    public final long load;
    // distance travelled from the depot when arriving here, skipped customers included
    public final double cumulativeDistance;

    public TripStop(int nodeId, long demand, long load, double cumulativeDistance) {
        this.nodeId = nodeId;
        this.demand = demand;
        this.load = load;
        this.cumulativeDistance = cumulativeDistance;
    }
}
