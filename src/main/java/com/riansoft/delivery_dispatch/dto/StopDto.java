package com.riansoft.delivery_dispatch.dto;

import java.util.Objects;

public class StopDto {
    private int nodeId;
    private String name;
    private String city;
    private String orderValue;
    private long demand;
    private double lat;
    private double lon;
    private long currentLoad;
    private double cumulativeDistanceMeters;

    public StopDto() {}

    public StopDto(int nodeId, String name, String city, String orderValue, long demand, double lat, double lon) {
        this.nodeId = nodeId;
        this.name = name;
        this.city = city;
        this.orderValue = orderValue;
        this.demand = demand;
        this.lat = lat;
        this.lon = lon;
    }

    // --- Getters and Setters ---
    public int getNodeId() { return nodeId; }
    public void setNodeId(int nodeId) { this.nodeId = nodeId; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getCity() { return city; }
    public void setCity(String city) { this.city = city; }
    public String getOrderValue() { return orderValue; }
    public void setOrderValue(String orderValue) { this.orderValue = orderValue; }
    public long getDemand() { return demand; }
    public void setDemand(long demand) { this.demand = demand; }
    public double getLat() { return lat; }
    public void setLat(double lat) { this.lat = lat; }
    public double getLon() { return lon; }
    public void setLon(double lon) { this.lon = lon; }
    public long getCurrentLoad() { return currentLoad; }
    public void setCurrentLoad(long currentLoad) { this.currentLoad = currentLoad; }
    public double getCumulativeDistanceMeters() { return cumulativeDistanceMeters; }
    public void setCumulativeDistanceMeters(double cumulativeDistanceMeters) { this.cumulativeDistanceMeters = cumulativeDistanceMeters; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StopDto stopDto = (StopDto) o;
        return nodeId == stopDto.nodeId && Double.compare(stopDto.lat, lat) == 0 && Double.compare(stopDto.lon, lon) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodeId, lat, lon);
    }
}
