package com.riansoft.delivery_dispatch.model;

public enum DispatchMode {
    /** Replay the single-trip visiting order in every round. */
    FIXED_ROUTE,
    /** Solve the remaining customers again before each round after the first. */
    REOPTIMIZE_PER_ROUND
}
