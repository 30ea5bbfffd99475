package com.riansoft.delivery_dispatch.dto;

import java.util.List;

public class DispatchPlanDto {
    private String mode;
    private long objectiveValue;
    private boolean capacityRelaxedForSolve;
    private List<PlannedRouteDto> singleTripRoutes;
    private List<RoundReportDto> rounds;
    private DispatchSummaryDto summary;
    private List<ExcludedRecordDto> excludedRecords;

    public DispatchPlanDto() {}

    public DispatchPlanDto(String mode, long objectiveValue, boolean capacityRelaxedForSolve,
                           List<PlannedRouteDto> singleTripRoutes, List<RoundReportDto> rounds,
                           DispatchSummaryDto summary, List<ExcludedRecordDto> excludedRecords) {
        this.mode = mode;
        this.objectiveValue = objectiveValue;
        this.capacityRelaxedForSolve = capacityRelaxedForSolve;
        this.singleTripRoutes = singleTripRoutes;
        this.rounds = rounds;
        this.summary = summary;
        this.excludedRecords = excludedRecords;
    }

    // --- Getters and Setters ---
    public String getMode() { return mode; }
    public void setMode(String mode) { this.mode = mode; }
    public long getObjectiveValue() { return objectiveValue; }
    public void setObjectiveValue(long objectiveValue) { this.objectiveValue = objectiveValue; }
    public boolean isCapacityRelaxedForSolve() { return capacityRelaxedForSolve; }
    public void setCapacityRelaxedForSolve(boolean capacityRelaxedForSolve) { this.capacityRelaxedForSolve = capacityRelaxedForSolve; }
    public List<PlannedRouteDto> getSingleTripRoutes() { return singleTripRoutes; }
    public void setSingleTripRoutes(List<PlannedRouteDto> singleTripRoutes) { this.singleTripRoutes = singleTripRoutes; }
    public List<RoundReportDto> getRounds() { return rounds; }
    public void setRounds(List<RoundReportDto> rounds) { this.rounds = rounds; }
    public DispatchSummaryDto getSummary() { return summary; }
    public void setSummary(DispatchSummaryDto summary) { this.summary = summary; }
    public List<ExcludedRecordDto> getExcludedRecords() { return excludedRecords; }
    public void setExcludedRecords(List<ExcludedRecordDto> excludedRecords) { this.excludedRecords = excludedRecords; }
}
