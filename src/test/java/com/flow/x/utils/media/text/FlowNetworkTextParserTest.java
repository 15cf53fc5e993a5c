package com.flow.x.utils.media.text;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.flow.x.dto.EdgeSpec;
import com.flow.x.dto.MaxFlowRequest;
import com.flow.x.exceptions.BadRequestException;
import com.flow.x.exceptions.InternalServerErrorException;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.List;
import org.junit.jupiter.api.Test;

final class FlowNetworkTextParserTest {

    @Test
    void parsesHeaderAndTriplesAcrossArbitraryWhitespace() {
        MaxFlowRequest request =
                FlowNetworkTextParser.parse(new StringReader("4 0 3\n0 1 10\n0 2\t10  1 3 5\n\n2 3 5\n"));

        assertEquals(4, request.getNodeCount());
        assertEquals(0, request.getSource());
        assertEquals(3, request.getSink());
        assertEquals(
                List.of(new EdgeSpec(0, 1, 10), new EdgeSpec(0, 2, 10), new EdgeSpec(1, 3, 5), new EdgeSpec(2, 3, 5)),
                request.getEdges());
    }

    @Test
    void headerWithoutEdgesIsAnEmptyNetwork() {
        MaxFlowRequest request = FlowNetworkTextParser.parse(new StringReader("2 0 1"));

        assertTrue(request.getEdges().isEmpty());
    }

    @Test
    void rejectsMissingHeader() {
        assertThrows(BadRequestException.class, () -> FlowNetworkTextParser.parse(new StringReader("3 0")));
    }

    @Test
    void rejectsTrailingPartialTriple() {
        BadRequestException e =
                assertThrows(BadRequestException.class, () -> FlowNetworkTextParser.parse(new StringReader("3 0 2\n0 1 4\n1 2")));

        assertTrue(e.getMessage().contains("token 7"), e.getMessage());
    }

    @Test
    void rejectsNonIntegerTokens() {
        BadRequestException e =
                assertThrows(BadRequestException.class, () -> FlowNetworkTextParser.parse(new StringReader("3 0 2\n0 1 4.5")));

        assertTrue(e.getMessage().contains("'4.5'"), e.getMessage());
    }

    @Test
    void wrapsReadFailures() {
        Reader broken =
                new Reader() {
                    @Override
                    public int read(char[] buffer, int offset, int length) throws IOException {
                        throw new IOException("disk gone");
                    }

                    @Override
                    public void close() {}
                };

        assertThrows(InternalServerErrorException.class, () -> FlowNetworkTextParser.parse(broken));
    }
}
