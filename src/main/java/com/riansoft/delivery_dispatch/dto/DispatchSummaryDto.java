package com.riansoft.delivery_dispatch.dto;

import java.util.List;

public class DispatchSummaryDto {
    private String status;
    private int roundsUsed;
    private int totalCustomers;
    private int servedCustomers;
    private boolean stalled;
    private double totalDistanceMeters;
    private List<UnservedCustomerDto> unservedCustomers;

    public DispatchSummaryDto() {}

    public DispatchSummaryDto(String status, int roundsUsed, int totalCustomers, int servedCustomers, boolean stalled,
                              double totalDistanceMeters, List<UnservedCustomerDto> unservedCustomers) {
        this.status = status;
        this.roundsUsed = roundsUsed;
        this.totalCustomers = totalCustomers;
        this.servedCustomers = servedCustomers;
        this.stalled = stalled;
        this.totalDistanceMeters = totalDistanceMeters;
        this.unservedCustomers = unservedCustomers;
    }

    // --- Getters and Setters ---
    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }
    public int getRoundsUsed() { return roundsUsed; }
    public void setRoundsUsed(int roundsUsed) { this.roundsUsed = roundsUsed; }
    public int getTotalCustomers() { return totalCustomers; }
    public void setTotalCustomers(int totalCustomers) { this.totalCustomers = totalCustomers; }
    public int getServedCustomers() { return servedCustomers; }
    public void setServedCustomers(int servedCustomers) { this.servedCustomers = servedCustomers; }
    public boolean isStalled() { return stalled; }
    public void setStalled(boolean stalled) { this.stalled = stalled; }
    public double getTotalDistanceMeters() { return totalDistanceMeters; }
    public void setTotalDistanceMeters(double totalDistanceMeters) { this.totalDistanceMeters = totalDistanceMeters; }
    public List<UnservedCustomerDto> getUnservedCustomers() { return unservedCustomers; }
    public void setUnservedCustomers(List<UnservedCustomerDto> unservedCustomers) { this.unservedCustomers = unservedCustomers; }
}
