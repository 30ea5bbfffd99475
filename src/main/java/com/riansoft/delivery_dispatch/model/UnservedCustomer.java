package com.riansoft.delivery_dispatch.model;

public class UnservedCustomer {
    public final int nodeId;
    public final long demand;
    public final UnservedReason reason;

    public UnservedCustomer(int nodeId, long demand, UnservedReason reason) {
        this.nodeId = nodeId;
        this.demand = demand;
        this.reason = reason;
    }
}
