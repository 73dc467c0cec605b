package de.bsommerfeld.cheru.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Running mode of the launcher backend. In {@link #TEST} mode validated
 * launch requests are recorded instead of spawned, so a test session can
 * select results without starting programs or locking the screen.
 */
public enum ApplicationMode {

    PROD,
    TEST;

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationMode.class);

    static final String PROPERTY = "app.mode";
    static final String ENVIRONMENT = "APP_MODE";

    /**
     * Resolves the mode from the {@code app.mode} system property, falling back
     * to the {@code APP_MODE} environment variable.
     */
    public static ApplicationMode get() {
        return resolve(System.getProperty(PROPERTY), System.getenv(ENVIRONMENT));
    }

    /**
     * The property wins over the environment when both are set. Blank or
     * unknown values resolve to {@link #PROD}.
     */
    static ApplicationMode resolve(String property, String environment) {
        String mode = property == null || property.isBlank() ? environment : property;
        if (mode == null || mode.isBlank())
            return PROD;

        try {
            return ApplicationMode.valueOf(mode.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            LOG.warn("Unknown application mode '{}', launches will spawn processes (PROD)", mode);
            return PROD;
        }
    }

    /** Whether validated launches start real processes. */
    public boolean spawnsProcesses() {
        return this == PROD;
    }
}
