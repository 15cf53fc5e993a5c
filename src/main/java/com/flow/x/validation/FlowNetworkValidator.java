package com.flow.x.validation;

import com.flow.x.dto.EdgeSpec;
import com.flow.x.dto.MaxFlowRequest;
import com.flow.x.exceptions.BadRequestException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Construction-boundary checks for {@link MaxFlowRequest}: bean constraints first, then the
 * cross-field rules the annotations cannot express.
 */
@Slf4j
public final class FlowNetworkValidator {

    private FlowNetworkValidator() {
        throw new UnsupportedOperationException("unsupported");
    }

    /**
     * @throws BadRequestException describing every violated constraint, or the first broken range rule
     */
    public static void validate(MaxFlowRequest request, Validator validator, int maxNodes, int maxEdges) {
        if (request == null) {
            throw new BadRequestException("Max-flow request must not be null");
        }

        Set<ConstraintViolation<MaxFlowRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            String message = violations.stream()
                    .map(v -> "Field '" + v.getPropertyPath() + "' " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining("; ", "Invalid request parameters: ", ""));
            throw new BadRequestException(message);
        }

        int n = request.getNodeCount();
        if (n > maxNodes) {
            throw new BadRequestException("number of nodes " + n + " exceeds the limit of " + maxNodes);
        }
        List<EdgeSpec> edges = request.getEdges();
        if (edges.size() > maxEdges) {
            throw new BadRequestException("number of edges " + edges.size() + " exceeds the limit of " + maxEdges);
        }
        requireInRange(request.getSource(), n, "source");
        requireInRange(request.getSink(), n, "sink");
        if (request.getSource() == request.getSink()) {
            throw new BadRequestException("source and sink must differ, both are " + request.getSource());
        }

        for (int i = 0; i < edges.size(); i++) {
            EdgeSpec edge = edges.get(i);
            requireInRange(edge.getFrom(), n, "edges[" + i + "].from");
            requireInRange(edge.getTo(), n, "edges[" + i + "].to");
        }
        requireBoundedTotal(edges, request.getSource(), true, "out of source");
        requireBoundedTotal(edges, request.getSink(), false, "into sink");
        log.debug("Validated max-flow request: nodes={}, edges={}, source={}, sink={}",
                n, edges.size(), request.getSource(), request.getSink());
    }

    /**
     * Every excess and the flow value are bounded by the capacity leaving the source, so both
     * terminal totals must fit in a {@code long}.
     */
    private static void requireBoundedTotal(List<EdgeSpec> edges, int terminal, boolean outgoing, String direction) {
        long total = 0L;
        try {
            for (EdgeSpec edge : edges) {
                if ((outgoing ? edge.getFrom() : edge.getTo()) == terminal) {
                    total = Math.addExact(total, edge.getCapacity());
                }
            }
        } catch (ArithmeticException e) {
            throw new BadRequestException("total capacity " + direction + " " + terminal + " exceeds " + Long.MAX_VALUE);
        }
    }

    private static void requireInRange(int id, int nodeCount, String field) {
        if (id < 0 || id >= nodeCount) {
            throw new BadRequestException("Field '" + field + "' node id " + id + " is out of range [0, " + nodeCount + ")");
        }
    }
}
