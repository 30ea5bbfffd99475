package com.riansoft.delivery_dispatch.model;

/**
 * Search configuration for the single-trip solve. Strategy names follow the OR-Tools enum constants.
 */
public class SolverSettings {
    public final String firstSolutionStrategy;
    public final String localSearchMetaheuristic;
    public final long timeLimitSeconds;
    public final boolean logSearch;
    public final boolean relaxCapacityWhenOversubscribed;

    public SolverSettings(String firstSolutionStrategy, String localSearchMetaheuristic, long timeLimitSeconds,
                          boolean logSearch, boolean relaxCapacityWhenOversubscribed) {
        if (timeLimitSeconds <= 0) {
            throw new IllegalArgumentException("timeLimitSeconds must be positive: " + timeLimitSeconds);
        }
        this.firstSolutionStrategy = firstSolutionStrategy;
        this.localSearchMetaheuristic = localSearchMetaheuristic;
        this.timeLimitSeconds = timeLimitSeconds;
        this.logSearch = logSearch;
        this.relaxCapacityWhenOversubscribed = relaxCapacityWhenOversubscribed;
    }
}
