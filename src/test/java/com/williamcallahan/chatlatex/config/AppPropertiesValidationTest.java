package com.williamcallahan.chatlatex.config;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import org.junit.jupiter.api.Test;

/**
 * Verifies start-up validation of export and formula settings.
 */
class AppPropertiesValidationTest {

    @Test
    void defaultsAreValid() {
        assertDoesNotThrow(new AppProperties()::validateConfiguration);
    }

    @Test
    void rejectsZeroCompilePasses() {
        AppProperties appProperties = new AppProperties();
        appProperties.getExport().setCompilePasses(0);

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsBlankCompilerCommand() {
        AppProperties appProperties = new AppProperties();
        appProperties.getExport().setCompilerCommand(" ");

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsNegativeCompileTimeout() {
        AppProperties appProperties = new AppProperties();
        appProperties.getExport().setCompileTimeout(Duration.ofSeconds(-1));

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsNonPositiveDpi() {
        AppProperties appProperties = new AppProperties();
        appProperties.getMath().setDefaultDpi(0);

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsNonPositiveMemoryCacheSize() {
        AppProperties appProperties = new AppProperties();
        appProperties.getMath().setMemoryCacheSize(0);

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }
}
