package com.rah.notification.whatsapp;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.kafka.annotation.EnableKafka;
import org.springframework.scheduling.annotation.EnableScheduling;
import sun.misc.Signal;

@SpringBootApplication
@EnableKafka
@EnableScheduling
@Slf4j
public class WhatsAppWorkerApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(WhatsAppWorkerApplication.class, args);
        exitCleanlyOn("INT", context);
        exitCleanlyOn("TERM", context);
    }

    /**
     * Close the context and exit with status 0 on the given signal, instead of the JVM's
     * default 128+n status.
     */
    private static void exitCleanlyOn(String signal, ConfigurableApplicationContext context) {
        try {
            Signal.handle(new Signal(signal), received -> {
                log.info("Received SIG{}, shutting down", received.getName());
                System.exit(shutdown(context));
            });
        } catch (IllegalArgumentException e) {
            log.warn("Cannot install SIG{} handler: {}", signal, e.getMessage());
        }
    }

    /**
     * Close the context through {@link SpringApplication#exit}; a requested stop maps to status 0
     * unless an {@code ExitCodeGenerator} bean reports otherwise.
     */
    static int shutdown(ConfigurableApplicationContext context) {
        return SpringApplication.exit(context, () -> 0);
    }
}
