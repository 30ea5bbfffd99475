package com.riansoft.delivery_dispatch.dto;

import java.time.Instant;

public class ErrorResponseDto {
    private String error;
    private String message;
    private Instant timestamp;

    public ErrorResponseDto() {}

    public ErrorResponseDto(String error, String message) {
        this.error = error;
        this.message = message;
        this.timestamp = Instant.now();
    }

    // --- Getters and Setters ---
    public String getError() { return error; }
    public void setError(String error) { this.error = error; }
    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }
    public Instant getTimestamp() { return timestamp; }
    public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }
}
