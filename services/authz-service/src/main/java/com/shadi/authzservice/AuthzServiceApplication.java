package com.shadi.authzservice;

import com.shadi.authzservice.config.AuthzProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Shadi authorization service.
 *
 * <p>Answers authorization questions for the platform's business services and receives the
 * session events (login, logout) and admin requests that trigger permission syncs. The decision
 * engine itself lives in {@code shadi-authz}; this module wires it to HTTP, the resource store and
 * actuator.
 */
@SpringBootApplication
@EnableConfigurationProperties(AuthzProperties.class)
public class AuthzServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(AuthzServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(AuthzServiceApplication.class, args);
        log.info("Shadi authorization service started");
    }
}
