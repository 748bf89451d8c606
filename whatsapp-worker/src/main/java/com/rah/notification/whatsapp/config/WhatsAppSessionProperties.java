package com.rah.notification.whatsapp.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * WhatsApp session settings ({@code worker.whatsapp.*}).
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "worker.whatsapp")
public class WhatsAppSessionProperties {

    /** Directory holding {@code creds.json}; survives restarts. */
    private String authDir = "./whatsapp-auth";

    /** Fixed delay before reconnecting after a non-terminal close. */
    private Duration reconnectDelay = Duration.ofSeconds(3);

    private String baseUrl = "https://wasenderapi.com/api";

    /** Account access token for session management. Never logged. */
    private String accessToken;

    private String sessionId;

    private Duration pollInterval = Duration.ofSeconds(10);

    private Duration sendTimeout = Duration.ofSeconds(30);
}
