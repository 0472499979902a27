package com.warden.gateway;

import com.warden.gateway.config.WardenProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Warden gateway: the HTTP front of the security gate.
 *
 * <p>Every tool call is authenticated, authorized against the RBAC policy, executed and audited.
 * Administrative endpoints issue tokens and revoke keys under the same gate.
 */
@SpringBootApplication
@EnableConfigurationProperties(WardenProperties.class)
public class WardenGatewayApplication {

    private static final Logger log = LoggerFactory.getLogger(WardenGatewayApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(WardenGatewayApplication.class, args);
        log.info("Warden gateway started");
    }
}
