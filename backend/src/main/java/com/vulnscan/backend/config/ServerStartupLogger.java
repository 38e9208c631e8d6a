package com.vulnscan.backend.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class ServerStartupLogger implements ApplicationListener<WebServerInitializedEvent> {

    private final VulnScanProperties properties;

    @Override
    public void onApplicationEvent(WebServerInitializedEvent event) {
        log.info("VulnScan orchestrator listening on port {} (scheduler={}, dispatch concurrency={}, results channel={})",
                event.getWebServer().getPort(),
                properties.getScheduler().isEnabled() ? "on" : "off",
                properties.getDispatcher().getConcurrency(),
                properties.getEngine().getResultChannel());
    }
}
