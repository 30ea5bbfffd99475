package com.riansoft.delivery_dispatch.dto;

import java.util.List;

public class CustomerListDto {
    private List<StopDto> customers;
    private List<ExcludedRecordDto> excludedRecords;

    public CustomerListDto() {}

    public CustomerListDto(List<StopDto> customers, List<ExcludedRecordDto> excludedRecords) {
        this.customers = customers;
        this.excludedRecords = excludedRecords;
    }

    // --- Getters and Setters ---
    public List<StopDto> getCustomers() { return customers; }
    public void setCustomers(List<StopDto> customers) { this.customers = customers; }
    public List<ExcludedRecordDto> getExcludedRecords() { return excludedRecords; }
    public void setExcludedRecords(List<ExcludedRecordDto> excludedRecords) { this.excludedRecords = excludedRecords; }
}
