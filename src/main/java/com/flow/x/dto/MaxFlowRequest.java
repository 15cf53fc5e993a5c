package com.flow.x.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MaxFlowRequest {
    @Min(value = 1, message = "number of nodes should not be below 1")
    private int nodeCount;

    @Min(value = 0, message = "source id must not be negative")
    private int source;

    @Min(value = 0, message = "sink id must not be negative")
    private int sink;

    @NotNull
    @Builder.Default
    private List<@Valid @NotNull EdgeSpec> edges = new ArrayList<>();
}
