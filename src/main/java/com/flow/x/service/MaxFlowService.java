package com.flow.x.service;

import com.flow.x.dto.MaxFlowRequest;
import com.flow.x.dto.MaxFlowResult;

import java.util.concurrent.CompletableFuture;

public interface MaxFlowService {
    MaxFlowResult solve(MaxFlowRequest request);
    CompletableFuture<MaxFlowResult> solveAsync(MaxFlowRequest request);
}
