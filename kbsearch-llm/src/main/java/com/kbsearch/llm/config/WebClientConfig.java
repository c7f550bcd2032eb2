package com.kbsearch.llm.config;

import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * Shared WebClient.Builder for the embedding provider and the document source fetcher.
 * Each consumer calls {@code build()} once at construction.
 */
@Configuration
@Slf4j
public class WebClientConfig {

    @Bean
    public WebClient.Builder webClientBuilder(HttpClientProperties http) {
        int maxBytes = http.getMaxInMemorySizeMb() * 1024 * 1024;
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(maxBytes))
                .build();

        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, http.getConnectTimeoutMs())
                .responseTimeout(Duration.ofSeconds(http.getResponseTimeoutSeconds()))
                .followRedirect(true);

        log.info("Outbound HTTP client | connectTimeoutMs={} | responseTimeoutSeconds={} | maxInMemoryMb={}",
                http.getConnectTimeoutMs(), http.getResponseTimeoutSeconds(), http.getMaxInMemorySizeMb());

        return WebClient.builder()
                .defaultHeader(HttpHeaders.USER_AGENT, http.getUserAgent())
                .exchangeStrategies(strategies)
                .clientConnector(new ReactorClientHttpConnector(httpClient));
    }
}
