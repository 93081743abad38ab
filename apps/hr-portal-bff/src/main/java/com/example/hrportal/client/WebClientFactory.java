package com.example.hrportal.client;

import com.example.hrportal.config.HrPortalProperties;
import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;

@Slf4j
@Component
public class WebClientFactory {

    private final WebClient hrApiClient;

    public WebClientFactory(WebClient.Builder webClientBuilder, HrPortalProperties properties) {
        this.hrApiClient = buildHrApiClient(webClientBuilder, properties.getClient().getHrApi());
    }

    /**
     * Shared WebClient for the HR REST backend. Timeouts live here; the
     * list-view layer never times out on its own.
     */
    public WebClient hrApiClient() {
        return hrApiClient;
    }

    private WebClient buildHrApiClient(WebClient.Builder webClientBuilder, HrPortalProperties.ServiceConfig config) {

        ConnectionProvider connectionProvider = ConnectionProvider.builder("hr-api-pool")
                .maxConnections(100)
                .pendingAcquireTimeout(Duration.ofSeconds(10))
                .maxIdleTime(Duration.ofSeconds(30))
                .evictInBackground(Duration.ofSeconds(30))
                .build();

        HttpClient httpClient = HttpClient.create(connectionProvider)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) config.getConnectTimeout().toMillis())
                .responseTimeout(config.getResponseTimeout())
                .keepAlive(true);

        log.info("Configured HR API client for {}", config.getBaseUrl());

        return webClientBuilder.clone()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .baseUrl(config.getBaseUrl())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .filter(loggingFilter())
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(config.getMaxInMemorySizeKb() * 1024))
                .build();
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("Request: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }
}
