package com.riansoft.delivery_dispatch.model;

/**
 * A location of the optimization instance. Id 0 is the depot, customers are numbered from 1.
 */
public class Node {
    public static final int DEPOT_ID = 0;

    public final int id;
    public final double longitude;
    public final double latitude;
    public final long demand;
    public final String name;
    public final String city;
    public final String orderValue;
    // -1 for the depot
    public final int sourceRow;

    public Node(int id, double longitude, double latitude, long demand,
                String name, String city, String orderValue, int sourceRow) {
        this.id = id;
        this.longitude = longitude;
        this.latitude = latitude;
        this.demand = demand;
        this.name = name;
        this.city = city;
        this.orderValue = orderValue;
        this.sourceRow = sourceRow;
    }

    public static Node depot(double longitude, double latitude) {
        return new Node(DEPOT_ID, longitude, latitude, 0, "DEPOT", null, null, -1);
    }

    public boolean isDepot() {
        return id == DEPOT_ID;
    }

    /**
     * Display label used in itineraries, falling back to "Customer n" when the record had no name.
     */
    public String displayName() {
        if (isDepot()) return "DEPOT";
        return (name == null || name.isBlank()) ? "Customer " + id : name;
    }

    public String coordinateString() {
        return longitude + "," + latitude;
    }
}
