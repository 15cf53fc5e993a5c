package com.flow.x.runner;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flow.x.dto.EdgeFlow;
import com.flow.x.dto.MaxFlowRequest;
import com.flow.x.dto.MaxFlowResult;
import com.flow.x.exceptions.InternalServerErrorException;
import com.flow.x.service.MaxFlowService;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.springframework.boot.DefaultApplicationArguments;

final class MaxFlowRunnerTest {

    @TempDir Path tempDir;

    private final MaxFlowService service = mock(MaxFlowService.class);
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

    @Test
    void doesNothingWithoutInput() {
        new MaxFlowRunner(service, "", out).run(new DefaultApplicationArguments());

        verifyNoInteractions(service);
        assertEquals(0, buffer.size());
    }

    @Test
    void solvesFileAndPrintsReport() throws Exception {
        Path file = tempDir.resolve("network.txt");
        Files.writeString(file, "2 0 1\n0 1 5\n");
        when(service.solve(any()))
                .thenReturn(
                        MaxFlowResult.builder()
                                .source(0)
                                .sink(1)
                                .maxFlow(5)
                                .edgeFlows(List.of(new EdgeFlow(0, 1, 5, 5)))
                                .build());

        new MaxFlowRunner(service, file.toString(), out).run(new DefaultApplicationArguments());

        ArgumentCaptor<MaxFlowRequest> captor = ArgumentCaptor.forClass(MaxFlowRequest.class);
        verify(service).solve(captor.capture());
        assertEquals(2, captor.getValue().getNodeCount());
        assertEquals(1, captor.getValue().getEdges().size());
        assertTrue(buffer.toString(StandardCharsets.UTF_8).startsWith("The maximum flow from node 0 to node 1 is 5"));
    }

    @Test
    void missingFileIsAnInternalError() {
        MaxFlowRunner runner = new MaxFlowRunner(service, tempDir.resolve("absent.txt").toString(), out);

        assertThrows(InternalServerErrorException.class, () -> runner.run(new DefaultApplicationArguments()));
        verifyNoInteractions(service);
    }
}
