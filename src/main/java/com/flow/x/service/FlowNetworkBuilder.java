package com.flow.x.service;

import com.flow.x.dto.EdgeSpec;
import com.flow.x.dto.MaxFlowRequest;
import com.flow.x.models.FlowNetwork;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class FlowNetworkBuilder {

    /**
     * Builds the residual network for a request that already passed validation. Storage is presized
     * from the request so the solve itself does not grow any collection.
     */
    public FlowNetwork build(MaxFlowRequest request) {
        FlowNetwork network = new FlowNetwork(request.getNodeCount(), request.getEdges().size());
        for (EdgeSpec edge : request.getEdges()) {
            network.addEdge(edge.getFrom(), edge.getTo(), edge.getCapacity());
        }
        log.debug("Built flow network: nodes={}, userEdges={}, residualEdges={}",
                network.nodeCount(), network.forwardEdgeCount(), network.edgeCount());
        return network;
    }
}
