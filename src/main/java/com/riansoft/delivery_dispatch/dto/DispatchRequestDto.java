package com.riansoft.delivery_dispatch.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public class DispatchRequestDto {
    @NotEmpty
    private List<@NotNull CustomerInputDto> customers;

    // Getters and Setters
    public List<CustomerInputDto> getCustomers() { return customers; }
    public void setCustomers(List<CustomerInputDto> customers) { this.customers = customers; }
}
