package com.tribe.matching.client;

import com.tribe.matching.config.AdvisoryProperties;
import com.tribe.matching.dto.AdvisoryResult;
import com.tribe.matching.exceptions.AdvisoryUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@DisplayName("OpenRouterAdvisoryClient Tests")
class OpenRouterAdvisoryClientTest {
    private MockRestServiceServer server;
    private OpenRouterAdvisoryClient client;

    @BeforeEach
    void setUp() {
        AdvisoryProperties properties = new AdvisoryProperties();
        properties.setBaseUrl("http://advisory.test/api/v1");
        properties.setApiKey("secret");
        properties.setModel("test-model");
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        client = new OpenRouterAdvisoryClient(builder, properties);
    }

    @Test
    @DisplayName("Should post a chat completion and return the first choice")
    void testScoreText() {
        // Given
        server.expect(requestTo("http://advisory.test/api/v1/chat/completions"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer secret"))
                .andExpect(jsonPath("$.model").value("test-model"))
                .andExpect(jsonPath("$.messages[0].content").value("rate them"))
                .andRespond(withSuccess("""
                        {"choices":[{"message":{"role":"assistant","content":"SCORE: 77\\nINSIGHTS: Fine."}}]}
                        """, MediaType.APPLICATION_JSON));

        // When
        AdvisoryResult result = client.scoreText("rate them");

        // Then
        assertEquals("SCORE: 77\nINSIGHTS: Fine.", result.text());
        assertEquals("test-model", result.model());
        server.verify();
    }

    @Test
    @DisplayName("Should report server errors and empty answers as unavailable")
    void testFailures() {
        server.expect(requestTo("http://advisory.test/api/v1/chat/completions")).andRespond(withServerError());
        assertThrows(AdvisoryUnavailableException.class, () -> client.scoreText("rate them"));

        server.reset();
        server.expect(requestTo("http://advisory.test/api/v1/chat/completions"))
                .andRespond(withSuccess("{\"choices\":[]}", MediaType.APPLICATION_JSON));
        assertThrows(AdvisoryUnavailableException.class, () -> client.scoreText("rate them"));
    }
}
