package com.deepansh.mq.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * One pooled Apache HttpClient connection manager shared by every provider client.
 *
 * Pool size starts from the configured batch worker count and grows to the per-run worker
 * count before a batch dispatches, so a wide batch never queues on connections.
 * Response timeouts are per request (callers pass the timeout of the call), so the pool
 * is shared and the RequestConfig is built per client.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Bean(destroyMethod = "close")
    public PoolingHttpClientConnectionManager llmConnectionManager(MqProperties properties) {
        int maxConnections = Math.max(16, properties.getBatch().getWorkers() * 2);
        log.debug("HTTP connection pool sized to {}", maxConnections);
        return PoolingHttpClientConnectionManagerBuilder.create()
                .setMaxConnTotal(maxConnections)
                .setMaxConnPerRoute(maxConnections)
                .setDefaultConnectionConfig(ConnectionConfig.custom()
                        .setConnectTimeout(Timeout.of(properties.getRequest().getConnectTimeout()))
                        .build())
                .build();
    }

    @Bean
    public RestClientFactory restClientFactory(PoolingHttpClientConnectionManager connectionManager) {
        return responseTimeout -> {
            CloseableHttpClient httpClient = HttpClients.custom()
                    .setConnectionManager(connectionManager)
                    .setConnectionManagerShared(true)
                    .setDefaultRequestConfig(RequestConfig.custom()
                            .setResponseTimeout(Timeout.of(responseTimeout))
                            .build())
                    .disableAutomaticRetries()
                    .build();
            return RestClient.builder()
                    .requestFactory(new HttpComponentsClientHttpRequestFactory(httpClient));
        };
    }

    @Bean
    public ConnectionCapacity connectionCapacity(PoolingHttpClientConnectionManager connectionManager) {
        return concurrent -> ensureCapacity(connectionManager, concurrent);
    }

    /** Grows the pool so that {@code concurrent} requests to one provider never wait for a lease. */
    static void ensureCapacity(PoolingHttpClientConnectionManager connectionManager, int concurrent) {
        if (connectionManager.getDefaultMaxPerRoute() < concurrent) {
            connectionManager.setDefaultMaxPerRoute(concurrent);
        }
        if (connectionManager.getMaxTotal() < concurrent) {
            connectionManager.setMaxTotal(concurrent);
        }
        log.debug("HTTP connection pool now {} per route, {} total",
                connectionManager.getDefaultMaxPerRoute(), connectionManager.getMaxTotal());
    }

    /** Makes room in the shared connection pool for a given number of concurrent requests. */
    @FunctionalInterface
    public interface ConnectionCapacity {
        void ensure(int concurrent);
    }

    /** Hands out RestClient builders whose response timeout is fixed to the given duration. */
    @FunctionalInterface
    public interface RestClientFactory {
        RestClient.Builder builder(Duration responseTimeout);
    }
}
