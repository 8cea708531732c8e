package com.machina.provisioning.config;

import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.util.concurrent.TimeUnit;

/**
 * Pooled HTTP client for cloud provider APIs.
 */
@Configuration
public class RestTemplateConfig {

    @Bean
    public PoolingHttpClientConnectionManager providerConnectionManager(
            @Value("${provider.http.connect-timeout-seconds:5}") int connectTimeoutSeconds,
            @Value("${provider.http.socket-timeout-seconds:30}") int socketTimeoutSeconds) {

        PoolingHttpClientConnectionManager cm = new PoolingHttpClientConnectionManager();
        cm.setMaxTotal(50);
        cm.setDefaultMaxPerRoute(20);
        cm.setDefaultConnectionConfig(ConnectionConfig.custom()
            .setConnectTimeout(Timeout.ofSeconds(connectTimeoutSeconds))
            .setSocketTimeout(Timeout.ofSeconds(socketTimeoutSeconds))
            .setValidateAfterInactivity(Timeout.ofSeconds(5))
            .setTimeToLive(60, TimeUnit.SECONDS)
            .build());
        return cm;
    }

    @Bean
    public CloseableHttpClient providerHttpClient(PoolingHttpClientConnectionManager providerConnectionManager) {
        return HttpClients.custom()
            .setConnectionManager(providerConnectionManager)
            .evictIdleConnections(Timeout.ofSeconds(30))
            .evictExpiredConnections()
            .build();
    }

    @Bean(name = "providerRestTemplate")
    public RestTemplate providerRestTemplate(CloseableHttpClient providerHttpClient) {
        HttpComponentsClientHttpRequestFactory factory = new HttpComponentsClientHttpRequestFactory(providerHttpClient);
        factory.setConnectTimeout((int) TimeUnit.SECONDS.toMillis(5));
        factory.setConnectionRequestTimeout((int) TimeUnit.SECONDS.toMillis(5));
        return new RestTemplate(factory);
    }
}
