/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.config;

import io.netty.channel.ChannelOption;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

@Configuration
public class WebClientConfig {
    private static final int RESOLVE_MAX_IN_MEMORY = 64 * 1024;

    @Bean
    public WebClient placesWebClient(GatewayProperties properties) {
        GatewayProperties.Provider provider = properties.provider();
        return WebClient.builder()
                .baseUrl(provider.baseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient(provider, false)))
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(cfg -> cfg.defaultCodecs().maxInMemorySize(RESOLVE_MAX_IN_MEMORY))
                        .build())
                .build();
    }

    /**
     * Binary fetches go to whatever host the provider handed out, so no base URL and no credentials.
     */
    @Bean
    public WebClient mediaFetchWebClient(GatewayProperties properties) {
        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient(properties.provider(), true)))
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(cfg -> cfg.defaultCodecs().maxInMemorySize(properties.media().maxPayloadBytes()))
                        .build())
                .build();
    }

    private static HttpClient httpClient(GatewayProperties.Provider provider, boolean followRedirects) {
        Duration connectTimeout = provider.connectTimeout() == null ? Duration.ofSeconds(5) : provider.connectTimeout();
        Duration responseTimeout = provider.responseTimeout() == null ? Duration.ofSeconds(15) : provider.responseTimeout();
        return HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connectTimeout.toMillis())
                .responseTimeout(responseTimeout)
                .followRedirect(followRedirects);
    }
}
