package com.riansoft.delivery_dispatch.model;

/**
 * Problem instance together with its distance matrix, the input shared by optimizer and scheduler.
 */
public class DataModel {
    public final ProblemInstance instance;
    public final DistanceMatrix distanceMatrix;
    public final int numVehicles;
    public final long[] vehicleCapacities;
    public final long[] demands;
    public final int depotIndex;

    public DataModel(ProblemInstance instance, DistanceMatrix distanceMatrix) {
        if (distanceMatrix.size() != instance.nodes.size()) {
            throw new IllegalArgumentException("Distance matrix size " + distanceMatrix.size()
                    + " does not match node count " + instance.nodes.size());
        }
        this.instance = instance;
        this.distanceMatrix = distanceMatrix;
        this.numVehicles = instance.numVehicles;
        this.vehicleCapacities = instance.vehicleCapacities;
        this.demands = instance.demands;
        this.depotIndex = instance.depotIndex;
    }
}
