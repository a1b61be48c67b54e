package com.deepansh.rag.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * Pooled Apache HttpClient behind the RestClient used for LLM calls.
 *
 * Summaries sit on the context-building path of a chat request, so the
 * response timeout is kept short: a hung provider must not hold the request
 * for longer than the summarizer's fallback is worth.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Value("${http.client.connect-timeout:5s}")
    private Duration connectTimeout;

    @Value("${http.client.response-timeout:20s}")
    private Duration responseTimeout;

    @Value("${http.client.max-connections:20}")
    private int maxConnections;

    @Bean
    public RestClient.Builder restClientBuilder() {
        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(
                        PoolingHttpClientConnectionManagerBuilder.create()
                                .setMaxConnTotal(maxConnections)
                                .setMaxConnPerRoute(maxConnections)
                                .setDefaultConnectionConfig(ConnectionConfig.custom()
                                        .setConnectTimeout(Timeout.of(connectTimeout))
                                        .setSocketTimeout(Timeout.of(responseTimeout))
                                        .build())
                                .build())
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(Timeout.of(responseTimeout))
                        .build())
                .build();

        log.info("HttpClient configured [connectTimeout={}ms, responseTimeout={}ms, maxConnections={}]",
                connectTimeout.toMillis(), responseTimeout.toMillis(), maxConnections);
        return RestClient.builder().requestFactory(new HttpComponentsClientHttpRequestFactory(httpClient));
    }
}
