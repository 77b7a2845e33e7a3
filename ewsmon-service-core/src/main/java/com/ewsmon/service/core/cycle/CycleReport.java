package com.ewsmon.service.core.cycle;

/** Counters of one finished probe cycle. */
public record CycleReport(int targets, int ok, int alerts) {

    static CycleReport empty() {
        return new CycleReport(0, 0, 0);
    }
}
