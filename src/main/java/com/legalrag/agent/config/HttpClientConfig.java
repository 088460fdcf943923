package com.legalrag.agent.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Pooled HttpClient shared by every outbound adapter (LLM, Qdrant, embeddings, web search).
 *
 * The agent loop itself imposes no timeouts: a node blocks on exactly one
 * round trip, so the connect/response limits configured here are the only
 * bound on how long a single step can take.
 *
 * Each adapter must call {@code builder.clone()} before setting its base URL.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Bean
    public RestClient.Builder ragRestClientBuilder(RagProperties properties) {
        RagProperties.Http http = properties.getHttp();

        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(
                        PoolingHttpClientConnectionManagerBuilder.create()
                                .setMaxConnTotal(http.getMaxConnections())
                                .setMaxConnPerRoute(http.getMaxConnections())
                                .setDefaultConnectionConfig(ConnectionConfig.custom()
                                        .setConnectTimeout(Timeout.ofMilliseconds(http.getConnectTimeoutMs()))
                                        .build())
                                .build())
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(Timeout.ofMilliseconds(http.getResponseTimeoutMs()))
                        .build())
                .build();

        log.info("HttpClient configured [connectTimeout={}ms, responseTimeout={}ms, maxConnections={}]",
                http.getConnectTimeoutMs(), http.getResponseTimeoutMs(), http.getMaxConnections());

        return RestClient.builder().requestFactory(new HttpComponentsClientHttpRequestFactory(httpClient));
    }
}
