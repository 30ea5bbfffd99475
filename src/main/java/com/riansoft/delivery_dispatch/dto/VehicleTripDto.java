package com.riansoft.delivery_dispatch.dto;

import java.util.List;

// One vehicle's deliveries in one round
public class VehicleTripDto {
    private int vehicleNumber;
    private List<StopDto> stops;
    private long load;
    private long capacity;
    private double distanceMeters;

    public VehicleTripDto() {}

    public VehicleTripDto(int vehicleNumber, List<StopDto> stops, long load, long capacity, double distanceMeters) {
        this.vehicleNumber = vehicleNumber;
        this.stops = stops;
        this.load = load;
        this.capacity = capacity;
        this.distanceMeters = distanceMeters;
    }

    // --- Getters and Setters ---
    public int getVehicleNumber() { return vehicleNumber; }
    public void setVehicleNumber(int vehicleNumber) { this.vehicleNumber = vehicleNumber; }
    public List<StopDto> getStops() { return stops; }
    public void setStops(List<StopDto> stops) { this.stops = stops; }
    public long getLoad() { return load; }
    public void setLoad(long load) { this.load = load; }
    public long getCapacity() { return capacity; }
    public void setCapacity(long capacity) { this.capacity = capacity; }
    public double getDistanceMeters() { return distanceMeters; }
    public void setDistanceMeters(double distanceMeters) { this.distanceMeters = distanceMeters; }
    public double getDistanceKm() { return distanceMeters / 1000.0; }
}
