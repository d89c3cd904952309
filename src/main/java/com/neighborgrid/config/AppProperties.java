package com.neighborgrid.config;

import com.neighborgrid.life.LifeRule;
import java.net.InetAddress;
import java.net.UnknownHostException;

import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
public class AppProperties {

    static final String DEFAULT_HOST = "0.0.0.0";
    static final int DEFAULT_PORT = 3000;
    static final int DEFAULT_LIFE_MAX_STEPS = 500;

    private final String bindHost;
    private final int bindPort;
    private final int lifeMaxSteps;
    private final LifeRule lifeDefaultRule;

    public AppProperties(Environment environment) {
        BindAddress address = determineBindAddress(environment);
        this.bindHost = address.host();
        this.bindPort = address.port();
        this.lifeMaxSteps = determineMaxSteps(environment);
        this.lifeDefaultRule = determineDefaultRule(environment);
    }

    public String getBindHost() {
        return bindHost;
    }

    public int getBindPort() {
        return bindPort;
    }

    public InetAddress getBindAddress() {
        try {
            return InetAddress.getByName(bindHost);
        } catch (UnknownHostException ex) {
            throw new IllegalStateException("Failed to resolve bind host: " + bindHost, ex);
        }
    }

    public int getLifeMaxSteps() {
        return lifeMaxSteps;
    }

    public LifeRule getLifeDefaultRule() {
        return lifeDefaultRule;
    }

    private String resolveOptional(Environment environment, String propertyKey, String envKey) {
        String value = environment.getProperty(propertyKey);
        if (StringUtils.hasText(value)) {
            return value.trim();
        }
        value = environment.getProperty(envKey);
        return StringUtils.hasText(value) ? value.trim() : null;
    }

    private BindAddress determineBindAddress(Environment environment) {
        String bindRaw = resolveOptional(environment, "app.bind-address", "APP_BIND_ADDR");
        if (StringUtils.hasText(bindRaw)) {
            String[] parts = bindRaw.split(":", 2);
            if (parts.length != 2 || !StringUtils.hasText(parts[0]) || !StringUtils.hasText(parts[1])) {
                throw new IllegalStateException("APP_BIND_ADDR must follow host:port format");
            }
            return new BindAddress(parts[0].trim(), parsePort(parts[1]));
        }

        String portValue = resolveOptional(environment, "server.port", "PORT");
        if (StringUtils.hasText(portValue)) {
            return new BindAddress(DEFAULT_HOST, parsePort(portValue));
        }
        return new BindAddress(DEFAULT_HOST, DEFAULT_PORT);
    }

    private int determineMaxSteps(Environment environment) {
        String raw = resolveOptional(environment, "app.life.max-steps", "LIFE_MAX_STEPS");
        if (raw == null) {
            return DEFAULT_LIFE_MAX_STEPS;
        }
        try {
            int steps = Integer.parseInt(raw);
            if (steps <= 0) {
                throw new IllegalStateException("LIFE_MAX_STEPS must be positive but was " + steps);
            }
            return steps;
        } catch (NumberFormatException ex) {
            throw new IllegalStateException("Invalid LIFE_MAX_STEPS value: " + raw, ex);
        }
    }

    private LifeRule determineDefaultRule(Environment environment) {
        String raw = resolveOptional(environment, "app.life.default-rule", "LIFE_DEFAULT_RULE");
        if (raw == null) {
            return LifeRule.defaultLife();
        }
        try {
            return LifeRule.parse(raw);
        } catch (IllegalArgumentException ex) {
            throw new IllegalStateException("Invalid LIFE_DEFAULT_RULE value: " + raw, ex);
        }
    }

    private int parsePort(String value) {
        try {
            int port = Integer.parseInt(value.trim());
            if (port <= 0 || port > 65535) {
                throw new IllegalStateException("Port out of range: " + port);
            }
            return port;
        } catch (NumberFormatException ex) {
            throw new IllegalStateException("Invalid port value: " + value, ex);
        }
    }

    private record BindAddress(String host, int port) {}
}
