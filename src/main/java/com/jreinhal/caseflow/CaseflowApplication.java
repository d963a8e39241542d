package com.jreinhal.caseflow;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.core.env.Environment;

@SpringBootApplication
public class CaseflowApplication {
    private static final Logger log = LoggerFactory.getLogger(CaseflowApplication.class);
    private final Environment environment;

    public CaseflowApplication(Environment environment) {
        this.environment = environment;
    }

    public static void main(String[] args) {
        SpringApplication.run(CaseflowApplication.class, (String[])args);
    }

    /**
     * DEV auth lets header-less requests act as a fixed lawyer, so it must never be
     * pointed at a hosted database.
     */
    @PostConstruct
    public void validateSecurityConfiguration() {
        String authMode = this.environment.getProperty("app.auth-mode", "DEV");
        String mongoUri = this.environment.getProperty("spring.data.mongodb.uri", "");
        boolean isDevMode = "DEV".equalsIgnoreCase(authMode);
        boolean isProductionDb = mongoUri.contains("mongodb+srv://") || mongoUri.contains("mongodb.net") || mongoUri.contains("atlas");
        if (isDevMode && isProductionDb) {
            log.error("=================================================================");
            log.error("  CRITICAL SECURITY ERROR: DEV AUTH MODE WITH PRODUCTION DATABASE");
            log.error("=================================================================");
            log.error("  Set AUTH_MODE=GATEWAY for deployments behind the API gateway.");
            String allowOverride = this.environment.getProperty("ALLOW_DEV_WITH_PRODUCTION_DB", "false");
            if (!"true".equalsIgnoreCase(allowOverride)) {
                throw new SecurityException("DEV auth mode cannot be used with a production database. Set AUTH_MODE=GATEWAY.");
            }
            log.warn("!!! DEV MODE OVERRIDE ACTIVE !!!");
        }
        log.info("Caseflow started with auth mode {}", authMode);
    }
}
