package com.neighborgrid.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.server.WebServerFactoryCustomizer;
import org.springframework.boot.web.servlet.server.ConfigurableServletWebServerFactory;
import org.springframework.stereotype.Component;

/**
 * Applies the resolved bind address to the embedded container and reports the life limits the
 * API will enforce.
 */
@Component
public class GridServerCustomizer implements WebServerFactoryCustomizer<ConfigurableServletWebServerFactory> {

    static final String DISPLAY_NAME = "neighborgrid";

    private static final Logger log = LoggerFactory.getLogger(GridServerCustomizer.class);

    private final AppProperties properties;

    public GridServerCustomizer(AppProperties properties) {
        this.properties = properties;
    }

    @Override
    public void customize(ConfigurableServletWebServerFactory factory) {
        factory.setDisplayName(DISPLAY_NAME);
        factory.setAddress(properties.getBindAddress());
        factory.setPort(properties.getBindPort());
        log.info("Grid API on {}:{}; life runs capped at {} steps, default rule {}",
                properties.getBindHost(),
                properties.getBindPort(),
                properties.getLifeMaxSteps(),
                properties.getLifeDefaultRule().label());
    }
}
