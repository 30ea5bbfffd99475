package com.riansoft.delivery_dispatch.model;

import java.util.List;

/**
 * Final coverage of a dispatch run. Callers check {@link #allServed()} before trusting the plan.
 */
public class DispatchSummary {
    public final int roundsUsed;
    public final int totalCustomers;
    public final int servedCount;
    public final List<UnservedCustomer> unserved;
    public final double totalDistance;
    public final boolean stalled;

    public DispatchSummary(int roundsUsed, int totalCustomers, int servedCount,
                           List<UnservedCustomer> unserved, double totalDistance, boolean stalled) {
        this.roundsUsed = roundsUsed;
        this.totalCustomers = totalCustomers;
        this.servedCount = servedCount;
        this.unserved = List.copyOf(unserved);
        this.totalDistance = totalDistance;
        this.stalled = stalled;
    }

    public boolean allServed() {
        return servedCount == totalCustomers;
    }

    public DispatchStatus status() {
        return allServed() ? DispatchStatus.FULLY_SERVED : DispatchStatus.SERVED_WITH_EXCEPTIONS;
    }
}
