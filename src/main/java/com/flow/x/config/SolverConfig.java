package com.flow.x.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;


@Component
@ConfigurationProperties(prefix = "flow.solver")
@Validated
@Getter
@Setter
public class SolverConfig {

    @NotBlank
    private String algorithm = "push-relabel";
    private boolean invariantChecks = false;
    @Min(1)
    private int maxNodes = 1_000_000;
    @Min(0)
    private int maxEdges = 10_000_000;
}
