package com.riansoft.delivery_dispatch.exception;

import java.util.Arrays;

/**
 * The single-trip solve returned no feasible assignment, so no dispatch can be attempted.
 */
public class NoSolutionFromOptimizerException extends DispatchException {
    private final int locationCount;
    private final int numVehicles;
    private final long[] vehicleCapacities;
    private final long totalDemand;
    private final String solverStatus;

    public NoSolutionFromOptimizerException(int locationCount, int numVehicles, long[] vehicleCapacities,
                                            long totalDemand, String solverStatus) {
        super(String.format("No solution found! locations: %d, vehicles: %d, capacities: %s, total demand: %d, solver status: %s",
                locationCount, numVehicles, Arrays.toString(vehicleCapacities), totalDemand, solverStatus));
        this.locationCount = locationCount;
        this.numVehicles = numVehicles;
        this.vehicleCapacities = vehicleCapacities.clone();
        this.totalDemand = totalDemand;
        this.solverStatus = solverStatus;
    }

    public int getLocationCount() { return locationCount; }
    public int getNumVehicles() { return numVehicles; }
    public long[] getVehicleCapacities() { return vehicleCapacities.clone(); }
    public long getTotalDemand() { return totalDemand; }
    public String getSolverStatus() { return solverStatus; }
}
