package me.golemcore.admission;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class AdmissionApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(AdmissionApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(AdmissionApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(AdmissionApplication.class.getMethod("main", String[].class));
    }
}
