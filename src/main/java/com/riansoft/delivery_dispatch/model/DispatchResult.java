package com.riansoft.delivery_dispatch.model;

import java.util.List;

public class DispatchResult {
    public final List<RoundResult> rounds;
    public final DispatchSummary summary;

    public DispatchResult(List<RoundResult> rounds, DispatchSummary summary) {
        this.rounds = List.copyOf(rounds);
        this.summary = summary;
    }
}
