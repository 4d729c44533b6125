package com.mediguard.ledger.config;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.classic.HttpClient;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.core5.util.Timeout;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP client for the anchor ledger's JSON-RPC endpoint
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class RestTemplateConfig {

    private static final int MAX_CONNECTIONS = 10;

    private final MeterRegistry meterRegistry;

    @Bean
    public RestTemplate anchorRestTemplate(RestTemplateBuilder builder, LedgerProperties properties) {
        LedgerProperties.EthereumProperties ethereum = properties.getAnchor().getEthereum();

        PoolingHttpClientConnectionManager connectionManager = new PoolingHttpClientConnectionManager();
        connectionManager.setMaxTotal(MAX_CONNECTIONS);
        connectionManager.setDefaultMaxPerRoute(MAX_CONNECTIONS);
        connectionManager.setDefaultConnectionConfig(ConnectionConfig.custom()
                .setConnectTimeout(Timeout.ofMilliseconds(ethereum.getConnectTimeout().toMillis()))
                .setSocketTimeout(Timeout.ofMilliseconds(ethereum.getReadTimeout().toMillis()))
                .build());

        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectionRequestTimeout(Timeout.ofMilliseconds(ethereum.getConnectTimeout().toMillis()))
                .setResponseTimeout(Timeout.ofMilliseconds(ethereum.getReadTimeout().toMillis()))
                .build();

        HttpClient httpClient = HttpClients.custom()
                .setConnectionManager(connectionManager)
                .setDefaultRequestConfig(requestConfig)
                .build();

        HttpComponentsClientHttpRequestFactory requestFactory = new HttpComponentsClientHttpRequestFactory(httpClient);

        RestTemplate restTemplate = builder
                .requestFactory(() -> requestFactory)
                .additionalInterceptors(metricsInterceptor())
                .build();

        log.info("Anchor RestTemplate configured with connect timeout {}, read timeout {}",
                ethereum.getConnectTimeout(), ethereum.getReadTimeout());
        return restTemplate;
    }

    private ClientHttpRequestInterceptor metricsInterceptor() {
        return (request, body, execution) -> {
            long startTime = System.currentTimeMillis();
            String host = request.getURI().getHost();
            try {
                ClientHttpResponse response = execution.execute(request, body);
                meterRegistry.counter("ledger.anchor.rpc.requests",
                        "host", String.valueOf(host),
                        "status", String.valueOf(response.getStatusCode().value())
                ).increment();
                return response;
            } catch (Exception e) {
                meterRegistry.counter("ledger.anchor.rpc.errors",
                        "host", String.valueOf(host),
                        "exception", e.getClass().getSimpleName()
                ).increment();
                throw e;
            } finally {
                log.debug("Anchor RPC {} {} took {}ms", request.getMethod(), request.getURI(),
                        System.currentTimeMillis() - startTime);
            }
        };
    }
}
