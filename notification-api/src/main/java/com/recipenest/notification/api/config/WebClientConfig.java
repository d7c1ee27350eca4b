package com.recipenest.notification.api.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * WebClient for outbound calls (recipient directory).
 * WebFlux auto-configuration is excluded in {@code NotificationApiApplication}, so this is the
 * only WebClient.Builder in the context.
 */
@Configuration
public class WebClientConfig {

    @Value("${notification.directory.timeout:5s}")
    private Duration responseTimeout;

    @Bean
    public WebClient.Builder webClientBuilder() {
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(responseTimeout);

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient));
    }
}
