package com.example.counseling.shared.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.h2.tools.Server;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.ContextRefreshedEvent;
import org.springframework.context.event.EventListener;

import java.sql.SQLException;

/**
 * Exposes the in-memory H2 database over web and TCP ports for local debugging.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(prefix = "counseling.h2-console", name = "enabled", havingValue = "true")
public class H2ConsoleConfig {

    private final AppProperties appProperties;

    private Server webServer;
    private Server tcpServer;

    @EventListener(ContextRefreshedEvent.class)
    public void start() throws SQLException {
        if (webServer != null) {
            return;
        }
        this.webServer = Server.createWebServer("-webPort", appProperties.getH2Console().getWebPort(), "-tcpAllowOthers").start();
        this.tcpServer = Server.createTcpServer("-tcpPort", appProperties.getH2Console().getTcpPort(), "-tcpAllowOthers").start();
        log.info("H2 console listening on web port {} and tcp port {}",
                appProperties.getH2Console().getWebPort(), appProperties.getH2Console().getTcpPort());
    }

    @EventListener(ContextClosedEvent.class)
    public void stop() {
        if (this.tcpServer != null) {
            this.tcpServer.stop();
        }
        if (this.webServer != null) {
            this.webServer.stop();
        }
    }
}
