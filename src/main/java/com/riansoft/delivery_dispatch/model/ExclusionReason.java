package com.riansoft.delivery_dispatch.model;

public enum ExclusionReason {
    UNPARSEABLE_COORDINATE,
    LATITUDE_OUT_OF_RANGE,
    LONGITUDE_OUT_OF_RANGE,
    OUTSIDE_SERVICE_AREA,
    INVALID_DEMAND
}
