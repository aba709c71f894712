package com.deepansh.graphagent.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Pooled Apache HttpClient behind every outbound RestClient (model backends,
 * embeddings, knowledge base).
 *
 * A stalled backend call is bounded only by these timeouts; a response timeout
 * surfaces as an I/O error, which the model client classifies as transient.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Bean
    public CloseableHttpClient outboundHttpClient(
            @Value("${http.client.max-connections:50}") int maxConnections,
            @Value("${http.client.connect-timeout-seconds:10}") long connectTimeoutSeconds,
            @Value("${http.client.response-timeout-seconds:120}") long responseTimeoutSeconds) {

        PoolingHttpClientConnectionManager connectionManager = PoolingHttpClientConnectionManagerBuilder.create()
                .setMaxConnTotal(maxConnections)
                .setMaxConnPerRoute(maxConnections)
                .setDefaultConnectionConfig(ConnectionConfig.custom()
                        .setConnectTimeout(Timeout.ofSeconds(connectTimeoutSeconds))
                        .setSocketTimeout(Timeout.ofSeconds(responseTimeoutSeconds))
                        .build())
                .build();

        log.info("Outbound HttpClient configured [maxConnections={}, responseTimeout={}s]",
                maxConnections, responseTimeoutSeconds);

        return HttpClients.custom()
                .setConnectionManager(connectionManager)
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(Timeout.ofSeconds(responseTimeoutSeconds))
                        .build())
                .build();
    }

    @Bean
    public RestClient.Builder outboundRestClientBuilder(CloseableHttpClient outboundHttpClient) {
        return RestClient.builder()
                .requestFactory(new HttpComponentsClientHttpRequestFactory(outboundHttpClient));
    }
}
