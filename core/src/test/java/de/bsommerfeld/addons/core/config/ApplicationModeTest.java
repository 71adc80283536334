package de.bsommerfeld.addons.core.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ApplicationModeTest {

    private String original;

    @BeforeEach
    void rememberProperty() {
        original = System.getProperty(ApplicationMode.PROPERTY);
    }

    @AfterEach
    void restoreProperty() {
        if (original != null)
            System.setProperty(ApplicationMode.PROPERTY, original);
        else
            System.clearProperty(ApplicationMode.PROPERTY);
    }

    @Test
    void get_shouldResolveFromSystemProperty() {
        System.setProperty(ApplicationMode.PROPERTY, "TEST");
        assertEquals(ApplicationMode.TEST, ApplicationMode.get());
    }

    @Test
    void get_shouldBeCaseInsensitive() {
        System.setProperty(ApplicationMode.PROPERTY, "test");
        assertEquals(ApplicationMode.TEST, ApplicationMode.get());
    }

    @Test
    void get_shouldFallBackToProdForUnknownValue() {
        System.setProperty(ApplicationMode.PROPERTY, "staging");
        assertEquals(ApplicationMode.PROD, ApplicationMode.get());
    }

    @Test
    void isTest_shouldOnlyBeTrueForTestMode() {
        assertTrue(ApplicationMode.TEST.isTest());
        assertFalse(ApplicationMode.PROD.isTest());
    }

    @Test
    void resolve_shouldFallBackToEnvironmentWhenPropertyIsBlank() {
        assertEquals(ApplicationMode.TEST, ApplicationMode.resolve(" ", "test"));
        assertEquals(ApplicationMode.PROD, ApplicationMode.resolve(null, null));
    }

    @Test
    void resolve_shouldPreferPropertyOverEnvironment() {
        assertEquals(ApplicationMode.PROD, ApplicationMode.resolve("prod", "TEST"));
    }
}
