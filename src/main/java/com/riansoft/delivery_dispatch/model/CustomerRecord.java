package com.riansoft.delivery_dispatch.model;

/**
 * One raw customer row as read from the input table. Values are kept as text until validation.
 */
public class CustomerRecord {
    public final int rowNumber;
    public final String latitude;
    public final String longitude;
    public final String name;
    public final String city;
    public final String orderValue;
    // null when the input has no demand column
    public final String demand;

    public CustomerRecord(int rowNumber, String latitude, String longitude,
                          String name, String city, String orderValue, String demand) {
        this.rowNumber = rowNumber;
        this.latitude = latitude;
        this.longitude = longitude;
        this.name = name;
        this.city = city;
        this.orderValue = orderValue;
        this.demand = demand;
    }

    public CustomerRecord(int rowNumber, String latitude, String longitude, String name, String city, String orderValue) {
        this(rowNumber, latitude, longitude, name, city, orderValue, null);
    }

    @Override
    public String toString() {
        return "Row " + rowNumber + ": " + latitude + ", " + longitude + " - " + (city == null ? "Unknown" : city);
    }
}
