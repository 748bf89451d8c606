package com.rah.notification.whatsapp.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Value("${server.port:8082}")
    private int serverPort;

    @Bean
    public OpenAPI whatsappWorkerOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("WhatsApp Worker API")
                        .description("Appointment notification worker. Consumes appointment-reminder and "
                                + "send-whatsapp jobs from Kafka and delivers them over the linked WhatsApp session. "
                                + "Exposes the session status and re-link operation for operators, "
                                + "plus actuator endpoints for health checks and metrics.")
                        .version("1.0.0"))
                .servers(List.of(
                        new Server().url("http://localhost:" + serverPort).description("Local Development Server")
                ));
    }
}
