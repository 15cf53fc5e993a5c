package com.flow.x.runner;

import com.flow.x.dto.MaxFlowRequest;
import com.flow.x.dto.MaxFlowResult;
import com.flow.x.exceptions.InternalServerErrorException;
import com.flow.x.service.MaxFlowService;
import com.flow.x.utils.media.text.FlowNetworkTextParser;
import com.flow.x.utils.media.text.FlowReportFormatter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Solves the network file named by {@code flow.input} on startup and prints the flow report.
 */
@Slf4j
@Component
public class MaxFlowRunner implements ApplicationRunner {

    private final MaxFlowService maxFlowService;
    private final String input;
    private final PrintStream out;

    @Autowired
    public MaxFlowRunner(MaxFlowService maxFlowService, @Value("${flow.input:}") String input) {
        this(maxFlowService, input, System.out);
    }

    MaxFlowRunner(MaxFlowService maxFlowService, String input, PrintStream out) {
        this.maxFlowService = maxFlowService;
        this.input = input;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (input == null || input.isBlank()) {
            log.debug("No flow.input configured; nothing to solve on startup");
            return;
        }

        Path path = Path.of(input);
        MaxFlowRequest request;
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            request = FlowNetworkTextParser.parse(reader);
        } catch (IOException e) {
            throw new InternalServerErrorException("Cannot read network file " + path + ": " + e.getMessage(), e);
        }

        MaxFlowResult result = maxFlowService.solve(request);
        out.print(FlowReportFormatter.format(result));
        out.flush();
    }
}
