package me.qbot.gateway;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class BotApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(BotApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(BotApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(BotApplication.class.getMethod("main", String[].class));
    }
}
