package com.psl.search.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class QueryExpansionGatewayTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private RestTemplate restTemplate;
    private MockRestServiceServer server;
    private QueryExpansionProperties properties;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        properties = new QueryExpansionProperties();
        properties.setEnabled(true);
        properties.setBaseUrl("https://llm.example.org/openai/");
        properties.setApiKey("key-1");
    }

    @Test
    void expandsWithCompletionVariations() {
        server.expect(requestTo("https://llm.example.org/openai/v1/chat/completions"))
            .andExpect(method(POST))
            .andExpect(header("Authorization", "Bearer key-1"))
            .andExpect(jsonPath("$.model").value("qwen/qwen3-32b"))
            .andExpect(jsonPath("$.messages[0].role").value("user"))
            .andRespond(withSuccess("{\"choices\":[{\"message\":{\"content\":"
                + "\"Sure: [\\\"MACHINE LEARNING\\\", \\\"statistical learning theory for classification\\\", "
                + "\\\"neural network optimization methods\\\", \\\"kernel methods\\\"]\"}}]}",
                MediaType.APPLICATION_JSON));

        QueryExpansion expansion = gateway().expand("machine learning");

        server.verify();
        assertTrue(expansion.isExpanded());
        assertEquals("llm", expansion.getMethod());
        assertThat(expansion.getQueries()).containsExactly(
            "machine learning",
            "statistical learning theory for classification",
            "neural network optimization methods"
        );
    }

    @Test
    void disabledReturnsOriginalOnlyWithoutCalling() {
        properties.setEnabled(false);

        QueryExpansion expansion = gateway().expand("soil carbon");

        server.verify();
        assertFalse(expansion.isExpanded());
        assertEquals(List.of("soil carbon"), expansion.getQueries());
        assertEquals("fallback", expansion.getMethod());
        assertEquals("disabled", expansion.getError());
    }

    @Test
    void serverErrorFallsBackToOriginal() {
        server.expect(requestTo("https://llm.example.org/openai/v1/chat/completions"))
            .andRespond(withServerError());

        QueryExpansion expansion = gateway().expand("soil carbon");

        assertEquals(List.of("soil carbon"), expansion.getQueries());
        assertEquals("http_500", expansion.getError());
    }

    @Test
    void proseCompletionFallsBackToOriginal() {
        server.expect(requestTo("https://llm.example.org/openai/v1/chat/completions"))
            .andRespond(withSuccess("{\"choices\":[{\"message\":{\"content\":\"I cannot help with that.\"}}]}",
                MediaType.APPLICATION_JSON));

        QueryExpansion expansion = gateway().expand("soil carbon");

        assertEquals(List.of("soil carbon"), expansion.getQueries());
        assertEquals("invalid_response", expansion.getError());
    }

    @Test
    void parsesArrayEmbeddedInProse() {
        assertEquals(List.of("a", "b"), gateway().parseVariations("```json\n[\"a\", \"b\"]\n```"));
        assertThatThrownBy(() -> gateway().parseVariations("[1, {\"x\": 2}]"))
            .isInstanceOf(QueryExpansionGateway.QueryExpansionFormatException.class);
        assertThatThrownBy(() -> gateway().parseVariations(null))
            .isInstanceOf(QueryExpansionGateway.QueryExpansionFormatException.class);
    }

    @Test
    void mergeKeepsOriginalFirstAndCaps() {
        List<String> merged = QueryExpansionGateway.merge(
            "Graph Networks",
            Arrays.asList(" graph networks ", null, "", "graph neural nets", "GRAPH NEURAL NETS", "message passing"),
            2
        );

        assertEquals(List.of("Graph Networks", "graph neural nets", "message passing"), merged);
        assertEquals(List.of("q"), QueryExpansionGateway.merge("q", List.of("a", "b"), 0));
    }

    @Test
    void promptQuotesTheQuery() {
        assertThat(QueryExpansionGateway.buildPrompt("crispr off-target effects"))
            .contains("\"crispr off-target effects\"")
            .contains("JSON array");
    }

    private QueryExpansionGateway gateway() {
        return new QueryExpansionGateway(restTemplate, properties, objectMapper);
    }
}
