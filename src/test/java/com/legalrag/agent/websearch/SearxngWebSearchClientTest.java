package com.legalrag.agent.websearch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.legalrag.agent.config.RagProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestClient;

import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class SearxngWebSearchClientTest {

    private MockRestServiceServer server;
    private SearxngWebSearchClient client;

    @BeforeEach
    void setUp() {
        RagProperties props = new RagProperties();
        props.getWebSearch().getSearxng().setBaseUrl("http://searx.test/");
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        client = new SearxngWebSearchClient(props, new ObjectMapper(), builder);
    }

    @Test
    void search_parsesAnswersAndRankScoredResults() {
        server.expect(requestTo("http://searx.test/search"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().formDataContains(Map.of(
                        "q", "Vietnam Labor Code probation period",
                        "format", "json")))
                .andRespond(withSuccess("""
                        {
                          "answers": ["Probation lasts at most 180 days"],
                          "results": [
                            {"title": "A", "url": "https://a.example", "content": "first", "engine": "google"},
                            {"title": "B", "url": "https://b.example", "content": "second"},
                            {"title": "C", "url": "https://c.example", "content": "third"}
                          ]
                        }
                        """, MediaType.APPLICATION_JSON));

        List<WebSearchHit> hits = client.search("Vietnam Labor Code probation period", 2);

        server.verify();
        assertThat(hits).hasSize(3);
        assertThat(hits.get(0).getType()).isEqualTo(WebSearchHit.Kind.ANSWER);
        assertThat(hits.get(0).getContent()).isEqualTo("Probation lasts at most 180 days");
        assertThat(hits.get(1).getTitle()).isEqualTo("A");
        assertThat(hits.get(1).getEngine()).isEqualTo("google");
        assertThat(hits.get(1).getScore()).isCloseTo(0.9, within(1e-9));
        assertThat(hits.get(2).getScore()).isCloseTo(0.8, within(1e-9));
        assertThat(hits.get(2).getEngine()).isEqualTo("unknown");
    }

    @Test
    void search_serverError_throws() {
        server.expect(requestTo("http://searx.test/search")).andRespond(withServerError());

        assertThatThrownBy(() -> client.search("anything", 3)).isInstanceOf(HttpServerErrorException.class);
    }

    @Test
    void search_malformedJson_throws() {
        server.expect(requestTo("http://searx.test/search"))
                .andRespond(withSuccess("<html>rate limited</html>", MediaType.TEXT_HTML));

        assertThatThrownBy(() -> client.search("anything", 3)).isInstanceOf(UncheckedIOException.class);
    }
}
