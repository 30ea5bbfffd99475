package com.riansoft.delivery_dispatch.model;

/**
 * Immutable per-run fleet and depot settings handed to the instance builder.
 */
public class FleetConfig {
    // upper bound for a single demand or capacity; keeps fleet and demand totals inside a long
    public static final long MAX_QUANTITY = 1_000_000_000L;

    public final int numVehicles;
    public final long vehicleCapacity;
    public final long demandPerCustomer;
    public final double depotLongitude;
    public final double depotLatitude;
    public final GeoBoundingBox serviceArea;

    public FleetConfig(int numVehicles, long vehicleCapacity, long demandPerCustomer,
                       double depotLongitude, double depotLatitude, GeoBoundingBox serviceArea) {
        if (numVehicles < 1) {
            throw new IllegalArgumentException("numVehicles must be at least 1: " + numVehicles);
        }
        if (vehicleCapacity < 1 || vehicleCapacity > MAX_QUANTITY) {
            throw new IllegalArgumentException("vehicleCapacity must be in [1, " + MAX_QUANTITY + "]: " + vehicleCapacity);
        }
        if (demandPerCustomer < 0 || demandPerCustomer > MAX_QUANTITY) {
            throw new IllegalArgumentException("demandPerCustomer must be in [0, " + MAX_QUANTITY + "]: " + demandPerCustomer);
        }
        if (depotLatitude < -90 || depotLatitude > 90 || depotLongitude < -180 || depotLongitude > 180) {
            throw new IllegalArgumentException("Depot coordinate out of range: " + depotLongitude + "," + depotLatitude);
        }
        if (serviceArea == null) {
            throw new IllegalArgumentException("serviceArea is required");
        }
        this.numVehicles = numVehicles;
        this.vehicleCapacity = vehicleCapacity;
        this.demandPerCustomer = demandPerCustomer;
        this.depotLongitude = depotLongitude;
        this.depotLatitude = depotLatitude;
        this.serviceArea = serviceArea;
    }

    public long totalCapacity() {
        return Math.multiplyExact(vehicleCapacity, (long) numVehicles);
    }
}
