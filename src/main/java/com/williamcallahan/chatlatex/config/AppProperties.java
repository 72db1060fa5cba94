package com.williamcallahan.chatlatex.config;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Binds the {@code app.*} settings and validates them once at start-up.
 */
@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private ExportConfig export = new ExportConfig();
    private MathRenderConfig math = new MathRenderConfig();

    /**
     * Validates every settings group; a bad value fails application start-up.
     *
     * @throws IllegalArgumentException when a setting is missing or out of range
     */
    @PostConstruct
    public void validateConfiguration() {
        export.validateConfiguration();
        math.validateConfiguration();
    }

    public ExportConfig getExport() {
        return export;
    }

    public void setExport(ExportConfig export) {
        this.export = export;
    }

    public MathRenderConfig getMath() {
        return math;
    }

    public void setMath(MathRenderConfig math) {
        this.math = math;
    }
}
