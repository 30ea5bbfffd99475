package com.riansoft.delivery_dispatch.dto;

import java.util.List;

public class RoundReportDto {
    private int round;
    private List<VehicleTripDto> vehicles;
    private int servedThisRound;
    private int totalServed;
    private double distanceMeters;

    public RoundReportDto() {}

    public RoundReportDto(int round, List<VehicleTripDto> vehicles, int servedThisRound, int totalServed, double distanceMeters) {
        this.round = round;
        this.vehicles = vehicles;
        this.servedThisRound = servedThisRound;
        this.totalServed = totalServed;
        this.distanceMeters = distanceMeters;
    }

    // --- Getters and Setters ---
    public int getRound() { return round; }
    public void setRound(int round) { this.round = round; }
    public List<VehicleTripDto> getVehicles() { return vehicles; }
    public void setVehicles(List<VehicleTripDto> vehicles) { this.vehicles = vehicles; }
    public int getServedThisRound() { return servedThisRound; }
    public void setServedThisRound(int servedThisRound) { this.servedThisRound = servedThisRound; }
    public int getTotalServed() { return totalServed; }
    public void setTotalServed(int totalServed) { this.totalServed = totalServed; }
    public double getDistanceMeters() { return distanceMeters; }
    public void setDistanceMeters(double distanceMeters) { this.distanceMeters = distanceMeters; }
}
