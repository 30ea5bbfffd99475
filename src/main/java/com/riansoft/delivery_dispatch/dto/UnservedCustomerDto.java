package com.riansoft.delivery_dispatch.dto;

public class UnservedCustomerDto {
    private int nodeId;
    private String name;
    private String city;
    private long demand;
    private String reason;

    public UnservedCustomerDto() {}

    public UnservedCustomerDto(int nodeId, String name, String city, long demand, String reason) {
        this.nodeId = nodeId;
        this.name = name;
        this.city = city;
        this.demand = demand;
        this.reason = reason;
    }

    // --- Getters and Setters ---
    public int getNodeId() { return nodeId; }
    public void setNodeId(int nodeId) { this.nodeId = nodeId; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getCity() { return city; }
    public void setCity(String city) { this.city = city; }
    public long getDemand() { return demand; }
    public void setDemand(long demand) { this.demand = demand; }
    public String getReason() { return reason; }
    public void setReason(String reason) { this.reason = reason; }
}
