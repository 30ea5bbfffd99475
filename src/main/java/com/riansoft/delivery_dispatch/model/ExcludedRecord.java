package com.riansoft.delivery_dispatch.model;

public class ExcludedRecord {
    public final CustomerRecord record;
    public final ExclusionReason reason;

    public ExcludedRecord(CustomerRecord record, ExclusionReason reason) {
        this.record = record;
        this.reason = reason;
    }
}
