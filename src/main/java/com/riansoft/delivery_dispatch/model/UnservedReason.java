package com.riansoft.delivery_dispatch.model;

public enum UnservedReason {
    /** Demand alone is larger than every vehicle's capacity. */
    DEMAND_EXCEEDS_CAPACITY,
    /** Demand is larger than the capacity of each vehicle whose route contains the customer. */
    CAPACITY_OF_ASSIGNED_VEHICLE_EXCEEDED,
    /** The customer appears in no vehicle route. */
    NOT_ROUTED,
    NO_PROGRESS
}
