package com.riansoft.delivery_dispatch.dto;

// One customer row posted to /api/dispatch. Values stay text so they are validated like CSV rows.
public class CustomerInputDto {
    private String latitude;
    private String longitude;
    private String name;
    private String city;
    private String orderValue;
    private String demand;

    public CustomerInputDto() {}

    public CustomerInputDto(String latitude, String longitude, String name, String city, String orderValue, String demand) {
        this.latitude = latitude;
        this.longitude = longitude;
        this.name = name;
        this.city = city;
        this.orderValue = orderValue;
        this.demand = demand;
    }

    // --- Getters and Setters ---
    public String getLatitude() { return latitude; }
    public void setLatitude(String latitude) { this.latitude = latitude; }
    public String getLongitude() { return longitude; }
    public void setLongitude(String longitude) { this.longitude = longitude; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getCity() { return city; }
    public void setCity(String city) { this.city = city; }
    public String getOrderValue() { return orderValue; }
    public void setOrderValue(String orderValue) { this.orderValue = orderValue; }
    public String getDemand() { return demand; }
    public void setDemand(String demand) { this.demand = demand; }
}
