package com.flow.x.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

/**
 * Work counters of one push-relabel run.
 */
@Builder
@AllArgsConstructor
@Data
public class SolverStats {
    private long pushes;
    private long saturatingPushes;
    private long relabels;
    private long dischargeSteps;
    private long deadEnds;
    private int peakQueueSize;
}
