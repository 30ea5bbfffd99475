package com.riansoft.delivery_dispatch.exception;

/**
 * The distance provider could not deliver a usable matrix.
 */
public class DistanceMatrixException extends DispatchException {
    private final int locationCount;
    private final Integer httpStatus;

    public DistanceMatrixException(String message, int locationCount, Integer httpStatus) {
        super(message + " (locations: " + locationCount + (httpStatus == null ? "" : ", status: " + httpStatus) + ")");
        this.locationCount = locationCount;
        this.httpStatus = httpStatus;
    }

    public DistanceMatrixException(String message, int locationCount, Throwable cause) {
        super(message + " (locations: " + locationCount + ")", cause);
        this.locationCount = locationCount;
        this.httpStatus = null;
    }

    public int getLocationCount() {
        return locationCount;
    }

    public Integer getHttpStatus() {
        return httpStatus;
    }
}
