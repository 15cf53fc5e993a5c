package com.flow.x.utils.media.text;

import com.flow.x.dto.EdgeSpec;
import com.flow.x.dto.MaxFlowRequest;
import com.flow.x.exceptions.BadRequestException;
import com.flow.x.exceptions.InternalServerErrorException;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;
import java.util.StringTokenizer;

/**
 * Reads a network in the plain text layout
 * <pre>
 * n s t
 * u v capacity
 * u v capacity
 * ...
 * </pre>
 * Tokens are separated by any whitespace; edge triples run to the end of the input.
 */
@Slf4j
public final class FlowNetworkTextParser {

    private FlowNetworkTextParser() {
        throw new UnsupportedOperationException("Unsupported");
    }

    public static MaxFlowRequest parse(Reader source) {
        List<String> tokens = tokenize(source);
        if (tokens.size() < 3) {
            throw new BadRequestException("Network text must start with node count, source and sink; found "
                    + tokens.size() + " token(s)");
        }

        int nodeCount = parseInt(tokens, 0, "node count");
        int s = parseInt(tokens, 1, "source");
        int t = parseInt(tokens, 2, "sink");

        int remaining = tokens.size() - 3;
        if (remaining % 3 != 0) {
            throw new BadRequestException("Incomplete edge triple at token " + (tokens.size() - remaining % 3 + 1)
                    + ": expected 'from to capacity'");
        }

        List<EdgeSpec> edges = new ArrayList<>(remaining / 3);
        for (int i = 3; i < tokens.size(); i += 3) {
            edges.add(EdgeSpec.builder()
                    .from(parseInt(tokens, i, "edge from"))
                    .to(parseInt(tokens, i + 1, "edge to"))
                    .capacity(parseLong(tokens, i + 2, "edge capacity"))
                    .build());
        }

        log.info("Parsed network text: nodes={}, source={}, sink={}, edges={}", nodeCount, s, t, edges.size());
        return MaxFlowRequest.builder()
                .nodeCount(nodeCount)
                .source(s)
                .sink(t)
                .edges(edges)
                .build();
    }

    private static List<String> tokenize(Reader source) {
        List<String> tokens = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(source)) {
            String line;
            while ((line = reader.readLine()) != null) {
                StringTokenizer tokenizer = new StringTokenizer(line);
                while (tokenizer.hasMoreTokens()) {
                    tokens.add(tokenizer.nextToken());
                }
            }
        } catch (IOException e) {
            log.error("Error reading network text: {}", e.getMessage(), e);
            throw new InternalServerErrorException("Error reading network text: " + e.getMessage(), e);
        }
        return tokens;
    }

    private static int parseInt(List<String> tokens, int index, String field) {
        try {
            return Integer.parseInt(tokens.get(index));
        } catch (NumberFormatException e) {
            throw new BadRequestException("Token " + (index + 1) + " (" + field + ") is not an integer: '" + tokens.get(index) + "'");
        }
    }

    private static long parseLong(List<String> tokens, int index, String field) {
        try {
            return Long.parseLong(tokens.get(index));
        } catch (NumberFormatException e) {
            throw new BadRequestException("Token " + (index + 1) + " (" + field + ") is not an integer: '" + tokens.get(index) + "'");
        }
    }
}
