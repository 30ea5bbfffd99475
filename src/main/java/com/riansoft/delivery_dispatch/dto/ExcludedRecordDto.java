package com.riansoft.delivery_dispatch.dto;

public class ExcludedRecordDto {
    private int row;
    private String latitude;
    private String longitude;
    private String name;
    private String city;
    private String reason;

    public ExcludedRecordDto() {}

    public ExcludedRecordDto(int row, String latitude, String longitude, String name, String city, String reason) {
        this.row = row;
        this.latitude = latitude;
        this.longitude = longitude;
        this.name = name;
        this.city = city;
        this.reason = reason;
    }

    // --- Getters and Setters ---
    public int getRow() { return row; }
    public void setRow(int row) { this.row = row; }
    public String getLatitude() { return latitude; }
    public void setLatitude(String latitude) { this.latitude = latitude; }
    public String getLongitude() { return longitude; }
    public void setLongitude(String longitude) { this.longitude = longitude; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getCity() { return city; }
    public void setCity(String city) { this.city = city; }
    public String getReason() { return reason; }
    public void setReason(String reason) { this.reason = reason; }
}
