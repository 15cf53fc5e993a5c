package com.flow.x.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

@Builder
@AllArgsConstructor
@Data
public class EdgeFlow {
    private int from;
    private int to;
    private long capacity;
    private long flow;
}
