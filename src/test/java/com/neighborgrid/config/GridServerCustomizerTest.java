package com.neighborgrid.config;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.springframework.boot.web.embedded.tomcat.TomcatServletWebServerFactory;
import org.springframework.mock.env.MockEnvironment;

class GridServerCustomizerTest {

    @Test
    void appliesBindAddressAndName() {
        AppProperties properties = new AppProperties(new MockEnvironment()
                .withProperty("app.bind-address", "127.0.0.1:8181"));
        TomcatServletWebServerFactory factory = new TomcatServletWebServerFactory();
        new GridServerCustomizer(properties).customize(factory);
        assertEquals(8181, factory.getPort());
        assertEquals("127.0.0.1", factory.getAddress().getHostAddress());
        assertEquals(GridServerCustomizer.DISPLAY_NAME, factory.getDisplayName());
    }

    @Test
    void defaultsBindAllInterfaces() {
        TomcatServletWebServerFactory factory = new TomcatServletWebServerFactory();
        new GridServerCustomizer(new AppProperties(new MockEnvironment())).customize(factory);
        assertEquals(AppProperties.DEFAULT_PORT, factory.getPort());
        assertEquals(AppProperties.DEFAULT_HOST, factory.getAddress().getHostAddress());
    }
}
