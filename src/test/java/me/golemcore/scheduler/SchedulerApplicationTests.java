package me.golemcore.scheduler;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class SchedulerApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(SchedulerApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(SchedulerApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(SchedulerApplication.class.getMethod("main", String[].class));
    }
}
