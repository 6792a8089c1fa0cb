package com.ai.concierge.client;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpRetrievalClientTest {

    private static final String URL = "http://retrieval.test/search";

    private MockRestServiceServer server;
    private HttpRetrievalClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new HttpRetrievalClient(restTemplate, "http://retrieval.test");
    }

    @Test
    void searchSendsFilterAndReadsDocuments() {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.query").value("cottage 9 rates"))
                .andExpect(jsonPath("$.k").value(5))
                .andExpect(jsonPath("$.filter.intent").value("pricing"))
                .andRespond(withSuccess("{\"documents\": ["
                        + "{\"content\": \"Cottage 9 costs PKR 33,000 per night.\", \"metadata\": {\"source\": \"pricing.md\"}, \"score\": 0.91},"
                        + "{\"content\": \"Check-in is at 2 pm.\"}]}", MediaType.APPLICATION_JSON));

        RetrievalResult result = client.search("cottage 9 rates", 5, Map.of("intent", "pricing"));

        assertTrue(result.success());
        assertEquals(2, result.documents().size());
        assertEquals("pricing.md", result.documents().get(0).source());
        assertEquals(0.91, result.documents().get(0).score(), 1e-9);
        assertEquals("unknown", result.documents().get(1).source());
        server.verify();
    }

    @Test
    void emptyFilterIsLeftOut() {
        server.expect(requestTo(URL))
                .andExpect(jsonPath("$.filter").doesNotExist())
                .andRespond(withSuccess("{\"documents\": []}", MediaType.APPLICATION_JSON));

        RetrievalResult result = client.search("hello", 3, Map.of());

        assertTrue(result.success());
        assertTrue(result.isEmpty());
    }

    @Test
    void failuresAreTyped() {
        server.expect(requestTo(URL)).andRespond(withServerError());
        server.expect(requestTo(URL)).andRespond(withSuccess("not json", MediaType.TEXT_PLAIN));

        assertEquals(RetrievalFailure.TRANSPORT, client.search("hello", 3, Map.of()).failure());
        assertEquals(RetrievalFailure.BAD_RESPONSE, client.search("hello", 3, Map.of()).failure());
    }
}
