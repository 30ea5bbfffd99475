package com.riansoft.delivery_dispatch.model;

public enum DispatchStatus {
    FULLY_SERVED,
    SERVED_WITH_EXCEPTIONS
}
