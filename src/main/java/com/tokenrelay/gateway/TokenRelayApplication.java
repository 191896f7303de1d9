package com.tokenrelay.gateway;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

@SpringBootApplication
public class TokenRelayApplication {

    private static final Logger log = LoggerFactory.getLogger(TokenRelayApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(TokenRelayApplication.class, args);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        log.info("╔═══════════════════════════════════════════════════╗");
        log.info("║           Token Relay Gateway v1.0.0              ║");
        log.info("║     Bearer relay with single-flight refresh       ║");
        log.info("╚═══════════════════════════════════════════════════╝");
        log.info("API 端点:");
        log.info("  POST/GET/DELETE /session");
        log.info("  ANY  /relay/**");
        log.info("  GET  /health");
        log.info("  GET  /metrics");
    }
}
