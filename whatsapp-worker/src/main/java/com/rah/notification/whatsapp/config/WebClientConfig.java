package com.rah.notification.whatsapp.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class WebClientConfig {

    @Value("${worker.settings.base-url:http://localhost:1337}")
    private String settingsBaseUrl;

    @Bean
    public WebClient settingsWebClient() {
        return WebClient.builder()
            .baseUrl(settingsBaseUrl)
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(1024 * 1024))
            .build();
    }

    @Bean
    public WebClient wasenderWebClient(WhatsAppSessionProperties properties) {
        return WebClient.builder()
            .baseUrl(properties.getBaseUrl())
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(10 * 1024 * 1024))
            .build();
    }
}
