package me.golemcore.browser;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class BrowserMcpApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(BrowserMcpApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(BrowserMcpApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(BrowserMcpApplication.class.getMethod("main", String[].class));
    }
}
