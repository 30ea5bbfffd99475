package com.riansoft.delivery_dispatch.dto;

import java.util.List;

// Single-trip route returned by the optimizer, before round partitioning
public class PlannedRouteDto {
    private int vehicleNumber;
    private List<Integer> nodeIds;
    private long plannedLoad;
    private double distanceMeters;

    public PlannedRouteDto() {}

    public PlannedRouteDto(int vehicleNumber, List<Integer> nodeIds, long plannedLoad, double distanceMeters) {
        this.vehicleNumber = vehicleNumber;
        this.nodeIds = nodeIds;
        this.plannedLoad = plannedLoad;
        this.distanceMeters = distanceMeters;
    }

    // --- Getters and Setters ---
    public int getVehicleNumber() { return vehicleNumber; }
    public void setVehicleNumber(int vehicleNumber) { this.vehicleNumber = vehicleNumber; }
    public List<Integer> getNodeIds() { return nodeIds; }
    public void setNodeIds(List<Integer> nodeIds) { this.nodeIds = nodeIds; }
    public long getPlannedLoad() { return plannedLoad; }
    public void setPlannedLoad(long plannedLoad) { this.plannedLoad = plannedLoad; }
    public double getDistanceMeters() { return distanceMeters; }
    public void setDistanceMeters(double distanceMeters) { this.distanceMeters = distanceMeters; }
}
