package com.example.counseling.shared.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.embedded.netty.NettyReactiveWebServerFactory;
import org.springframework.boot.web.server.WebServerFactoryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.netty.resources.LoopResources;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class NettyConfig {

    @Value("${spring.application.name:counseling}")
    private String applicationName;

    /**
     * Names the event-loop threads after the application so socket handling is easy to spot in thread dumps.
     */
    @Bean
    public WebServerFactoryCustomizer<NettyReactiveWebServerFactory> nettyWebServerCustomizer() {
        return factory -> {
            LoopResources loopResources = LoopResources.create(
                applicationName,
                LoopResources.DEFAULT_IO_WORKER_COUNT,
                true
            );
            factory.addServerCustomizers(server -> server.runOn(loopResources));
            log.info("Customized Netty server with thread prefix '{}' and default worker count.", applicationName);
        };
    }
}
