package com.flow.x.dto;

import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EdgeSpec {
    @Min(value = 0, message = "from node id must not be negative")
    private int from;

    @Min(value = 0, message = "to node id must not be negative")
    private int to;

    @Min(value = 0, message = "capacity must not be negative")
    private long capacity;
}
