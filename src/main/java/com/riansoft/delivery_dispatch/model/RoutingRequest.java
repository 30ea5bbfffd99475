package com.riansoft.delivery_dispatch.model;

/**
 * Input of one single-trip solve.
 */
public class RoutingRequest {
    public final long[][] distanceMatrix;
    public final int numVehicles;
    public final long[] vehicleCapacities;
    public final long[] demands;
    public final int depotIndex;
    public final SolverSettings settings;
    // true when vehicleCapacities were raised above the real capacities so every customer can be ordered
    public final boolean capacityRelaxed;

    public RoutingRequest(long[][] distanceMatrix, int numVehicles, long[] vehicleCapacities, long[] demands,
                          int depotIndex, SolverSettings settings, boolean capacityRelaxed) {
        if (vehicleCapacities.length != numVehicles) {
            throw new IllegalArgumentException("Expected " + numVehicles + " capacities, got " + vehicleCapacities.length);
        }
        if (demands.length != distanceMatrix.length) {
            throw new IllegalArgumentException("Expected " + distanceMatrix.length + " demands, got " + demands.length);
        }
        this.distanceMatrix = distanceMatrix;
        this.numVehicles = numVehicles;
        this.vehicleCapacities = vehicleCapacities;
        this.demands = demands;
        this.depotIndex = depotIndex;
        this.settings = settings;
        this.capacityRelaxed = capacityRelaxed;
    }

    public static RoutingRequest forDataModel(DataModel data, SolverSettings settings) {
        return create(data.distanceMatrix.toLongMatrix(), data.demands, data.vehicleCapacities, data.depotIndex, settings);
    }

    /**
     * Builds a solver request, relaxing capacities when allowed by the settings.
     * <p>
     * When the fleet cannot take every customer in one pass (total demand above fleet capacity, or a single
     * demand above the smallest vehicle), each vehicle is offered
     * {@code max(capacity, ceil(totalDemand / vehicles), maxDemand)} so the returned visiting order still
     * covers all customers. Real capacities are enforced later by the round scheduler.
     */
    public static RoutingRequest create(long[][] distanceMatrix, long[] demands, long[] vehicleCapacities,
                                        int depotIndex, SolverSettings settings) {
        long[] capacities = vehicleCapacities.clone();
        long totalDemand = 0;
        long maxDemand = 0;
        for (long demand : demands) {
            totalDemand = Math.addExact(totalDemand, demand);
            maxDemand = Math.max(maxDemand, demand);
        }
        long totalCapacity = 0;
        long minCapacity = Long.MAX_VALUE;
        for (long capacity : capacities) {
            totalCapacity = Math.addExact(totalCapacity, capacity);
            minCapacity = Math.min(minCapacity, capacity);
        }

        boolean oversubscribed = totalDemand > totalCapacity || maxDemand > minCapacity;
        boolean relaxed = false;
        if (settings.relaxCapacityWhenOversubscribed && oversubscribed) {
            long share = totalDemand / capacities.length + (totalDemand % capacities.length == 0 ? 0 : 1);
            for (int v = 0; v < capacities.length; v++) {
                capacities[v] = Math.max(capacities[v], Math.max(share, maxDemand));
            }
            relaxed = true;
        }
        return new RoutingRequest(distanceMatrix, capacities.length, capacities, demands.clone(), depotIndex, settings, relaxed);
    }
}
