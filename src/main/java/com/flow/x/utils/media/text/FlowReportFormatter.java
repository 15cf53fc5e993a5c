package com.flow.x.utils.media.text;

import com.flow.x.dto.EdgeFlow;
import com.flow.x.dto.MaxFlowResult;

/**
 * Renders a solved network as a fixed-width table, one row per user edge in input order.
 */
public final class FlowReportFormatter {

    private static final String NO_FLOW = "-";

    private FlowReportFormatter() {
        throw new UnsupportedOperationException("Unsupported");
    }

    public static String format(MaxFlowResult result) {
        StringBuilder out = new StringBuilder();
        out.append("The maximum flow from node ").append(result.getSource())
                .append(" to node ").append(result.getSink())
                .append(" is ").append(result.getMaxFlow()).append('\n')
                .append("Flow graph:\n\n")
                .append(String.format("%6s %6s%13s\n\n", "from", "to", "flow"));

        for (EdgeFlow edge : result.getEdgeFlows()) {
            String flow = edge.getFlow() > 0 ? Long.toString(edge.getFlow()) : NO_FLOW;
            out.append(String.format("%6d %6d%13s\n", edge.getFrom(), edge.getTo(), flow));
        }
        return out.toString();
    }
}
