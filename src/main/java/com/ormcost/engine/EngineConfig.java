package com.ormcost.engine;

import com.ormcost.spi.ConfigurationException;
import com.ormcost.spi.ValidationResult;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Properties;

/**
 * Engine configuration. Read-only once the engine is constructed.
 *
 * @param internalPrefixes  package prefixes (ending in {@code '.'}) or class names whose frames are never an origin
 * @param captureParameters whether bound parameters are kept on query events
 * @param logReports        whether each finished report is summarized to the log
 */
public record EngineConfig(
        List<String> internalPrefixes,
        boolean captureParameters,
        boolean logReports
) {

    public static final String RESOURCE = "ormcost.properties";

    public static final String KEY_INTERNAL_PREFIXES = "ormcost.internal-prefixes";
    public static final String KEY_ADDITIONAL_INTERNAL_PREFIXES = "ormcost.additional-internal-prefixes";
    public static final String KEY_CAPTURE_PARAMETERS = "ormcost.capture-parameters";
    public static final String KEY_LOG_REPORTS = "ormcost.log-reports";

    public static final List<String> DEFAULT_INTERNAL_PREFIXES = List.of(
            // engine
            "com.ormcost.",
            // JDK
            "java.",
            "javax.",
            "jdk.",
            "sun.",
            "com.sun.",
            // drivers and ORMs
            "com.mongodb.",
            "org.bson.",
            "org.hibernate.",
            "org.springframework.",
            "org.apache.ibatis.",
            "org.jooq.",
            "com.zaxxer.hikari.",
            // logging
            "org.slf4j.",
            "ch.qos.logback.",
            // test runners
            "org.junit.",
            "org.apache.maven.surefire."
    );

    public EngineConfig {
        Objects.requireNonNull(internalPrefixes, "internalPrefixes must not be null");
        internalPrefixes = List.copyOf(internalPrefixes);
    }

    public static EngineConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Validates the configuration.
     */
    public ValidationResult validate() {
        List<ValidationResult.ValidationError> errors = new ArrayList<>();
        if (internalPrefixes.isEmpty()) {
            errors.add(new ValidationResult.ValidationError(KEY_INTERNAL_PREFIXES,
                    "at least one internal prefix is required"));
        }
        for (String prefix : internalPrefixes) {
            if (prefix.isBlank() || prefix.equals(".")) {
                errors.add(new ValidationResult.ValidationError(KEY_INTERNAL_PREFIXES,
                        "invalid prefix '" + prefix + "'"));
            }
        }
        return errors.isEmpty() ? ValidationResult.success() : ValidationResult.failure(errors);
    }

    /**
     * Loads {@value #RESOURCE} from the context class loader; defaults when the resource is absent.
     *
     * @throws ConfigurationException if the resource cannot be read or holds invalid values
     */
    public static EngineConfig load() {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = EngineConfig.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                return defaults();
            }
            Properties properties = new Properties();
            properties.load(in);
            return fromProperties(properties);
        } catch (IOException e) {
            throw new ConfigurationException("Could not read " + RESOURCE + ": " + e.getMessage());
        }
    }

    /**
     * Builds a configuration from properties; absent keys keep their defaults.
     *
     * @throws ConfigurationException on malformed values
     */
    public static EngineConfig fromProperties(Properties properties) {
        Builder builder = builder();
        List<ValidationResult.ValidationError> errors = new ArrayList<>();

        String prefixes = properties.getProperty(KEY_INTERNAL_PREFIXES);
        if (prefixes != null) {
            builder.internalPrefixes(splitList(prefixes));
        }
        String additional = properties.getProperty(KEY_ADDITIONAL_INTERNAL_PREFIXES);
        if (additional != null) {
            splitList(additional).forEach(builder::addInternalPrefix);
        }

        Boolean captureParameters = parseBoolean(properties, KEY_CAPTURE_PARAMETERS, errors);
        if (captureParameters != null) {
            builder.captureParameters(captureParameters);
        }
        Boolean logReports = parseBoolean(properties, KEY_LOG_REPORTS, errors);
        if (logReports != null) {
            builder.logReports(logReports);
        }

        if (!errors.isEmpty()) {
            throw new ConfigurationException(ValidationResult.failure(errors));
        }
        return builder.build();
    }

    private static List<String> splitList(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private static Boolean parseBoolean(Properties properties, String key,
                                        List<ValidationResult.ValidationError> errors) {
        String value = properties.getProperty(key);
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.equalsIgnoreCase("true")) {
            return Boolean.TRUE;
        }
        if (trimmed.equalsIgnoreCase("false")) {
            return Boolean.FALSE;
        }
        errors.add(new ValidationResult.ValidationError(key, "expected true or false but was '" + value + "'"));
        return null;
    }

    public static final class Builder {
        private final List<String> internalPrefixes = new ArrayList<>(DEFAULT_INTERNAL_PREFIXES);
        private boolean captureParameters;
        private boolean logReports = true;

        private Builder() {}

        /**
         * Replaces the internal prefixes, defaults included.
         */
        public Builder internalPrefixes(List<String> prefixes) {
            internalPrefixes.clear();
            internalPrefixes.addAll(prefixes);
            return this;
        }

        public Builder addInternalPrefix(String prefix) {
            internalPrefixes.add(Objects.requireNonNull(prefix, "prefix must not be null"));
            return this;
        }

        public Builder captureParameters(boolean captureParameters) {
            this.captureParameters = captureParameters;
            return this;
        }

        public Builder logReports(boolean logReports) {
            this.logReports = logReports;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(internalPrefixes, captureParameters, logReports);
        }
    }
}
