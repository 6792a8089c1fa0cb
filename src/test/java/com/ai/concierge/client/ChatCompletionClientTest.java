package com.ai.concierge.client;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class ChatCompletionClientTest {

    private static final String URL = "https://completions.test/v1/chat/completions";

    private MockRestServiceServer server;
    private ChatCompletionClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new ChatCompletionClient(restTemplate, "https://completions.test/v1/", "secret", "test-model", 0.1);
    }

    @Test
    void generateReturnsMessageContent() {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer secret"))
                .andExpect(jsonPath("$.model").value("test-model"))
                .andExpect(jsonPath("$.max_tokens").value(64))
                .andExpect(jsonPath("$.messages[0].content").value("hello?"))
                .andRespond(withSuccess("{\"choices\": [{\"message\": {\"content\": \"  Hi there  \"}}]}",
                        MediaType.APPLICATION_JSON));

        CompletionResult result = client.generate("hello?", 64);

        assertTrue(result.success());
        assertEquals("Hi there", result.text());
        server.verify();
    }

    @Test
    void generateReportsEmptyAndTransportFailures() {
        server.expect(requestTo(URL))
                .andRespond(withSuccess("{\"choices\": [{\"message\": {\"content\": \"\"}}]}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(URL)).andRespond(withServerError());

        assertEquals(CompletionFailure.EMPTY, client.generate("hello?", 64).failure());
        assertEquals(CompletionFailure.TRANSPORT, client.generate("hello?", 64).failure());
    }

    @Test
    void generateReportsMissingBodyAsEmpty() {
        server.expect(requestTo(URL)).andRespond(withSuccess());

        CompletionResult result = client.generate("hello?", 64);

        assertFalse(result.success());
        assertEquals(CompletionFailure.EMPTY, result.failure());
        server.verify();
    }

    @Test
    void generateReportsUnparseableBody() {
        server.expect(requestTo(URL)).andRespond(withSuccess("<html>bad gateway</html>", MediaType.TEXT_HTML));

        assertEquals(CompletionFailure.BAD_RESPONSE, client.generate("hello?", 64).failure());
    }

    @Test
    void streamConcatenatesDeltasUntilDone() {
        String events = "data: {\"choices\": [{\"delta\": {\"role\": \"assistant\"}}]}\n\n"
                + "data: {\"choices\": [{\"delta\": {\"content\": \"Yes, \"}}]}\n\n"
                + ": keep-alive\n\n"
                + "data: {\"choices\": [{\"delta\": {\"content\": \"it is gated.\"}}]}\n\n"
                + "data: [DONE]\n\n"
                + "data: {\"choices\": [{\"delta\": {\"content\": \"ignored\"}}]}\n\n";
        server.expect(requestTo(URL))
                .andExpect(jsonPath("$.stream").value(true))
                .andRespond(withSuccess(events, MediaType.TEXT_EVENT_STREAM));
        List<String> chunks = new ArrayList<>();

        CompletionResult result = client.stream("is it safe?", 128, chunks::add);

        assertEquals(List.of("Yes, ", "it is gated."), chunks);
        assertEquals("Yes, it is gated.", result.text());
    }

    @Test
    void streamLines() throws Exception {
        assertNull(client.parseStreamLine(""));
        assertNull(client.parseStreamLine("event: ping"));
        assertNull(client.parseStreamLine("data: "));
        assertEquals("[DONE]", client.parseStreamLine("data: [DONE]"));
        assertEquals("ok", client.parseStreamLine("data: {\"choices\": [{\"delta\": {\"content\": \"ok\"}}]}"));
        assertNull(client.parseStreamLine("data: {\"choices\": [{\"delta\": {\"content\": null}}]}"));
    }

    @Test
    void disabledClientNeverCallsOut() {
        DisabledCompletionClient disabled = new DisabledCompletionClient();

        assertFalse(disabled.isConfigured());
        assertEquals(CompletionFailure.NOT_CONFIGURED, disabled.generate("hi", 10).failure());
        assertEquals(CompletionFailure.NOT_CONFIGURED, disabled.stream("hi", 10, chunk -> fail("no chunks expected")).failure());
    }
}
