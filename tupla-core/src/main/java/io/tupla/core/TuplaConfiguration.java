package io.tupla.core;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Properties;

/**
 * Immutable configuration for a {@code TuplaArena}.
 * <p>
 * Use the builder pattern to create custom configurations:
 * <pre>
 * TuplaConfiguration config = TuplaConfiguration.builder()
 *     .defaultVisibility(Visibility.PUBLIC)
 *     .acceptTimeout(Duration.ofSeconds(1))
 *     .build();
 * </pre>
 * or load it from properties with {@link #fromProperties(Properties)} /
 * {@link #load()}:
 * <pre>
 * tupla.default-visibility=public
 * tupla.accept-timeout-millis=1000
 * tupla.fair-locks=false
 * </pre>
 * All configuration is immutable once built.
 */
public final class TuplaConfiguration {

    public static final String RESOURCE = "tupla.properties";
    public static final String DEFAULT_VISIBILITY_KEY = "tupla.default-visibility";
    public static final String ACCEPT_TIMEOUT_KEY = "tupla.accept-timeout-millis";
    public static final String FAIR_LOCKS_KEY = "tupla.fair-locks";

    // Applied to tables created without an explicit visibility
    private final Visibility defaultVisibility;

    // Wait used by accept() overloads without a timeout
    private final Duration acceptTimeout;

    // Table lock fairness
    private final boolean fairLocks;

    private TuplaConfiguration(Builder builder) {
        this.defaultVisibility = builder.defaultVisibility;
        this.acceptTimeout = builder.acceptTimeout;
        this.fairLocks = builder.fairLocks;
    }

    /**
     * Create a new builder for TuplaConfiguration.
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static TuplaConfiguration defaults() {
        return builder().build();
    }

    /**
     * Build a configuration from properties; missing keys keep their defaults.
     *
     * @param properties the property source
     * @return the configuration
     * @throws IllegalArgumentException if a present value cannot be parsed
     */
    public static TuplaConfiguration fromProperties(Properties properties) {
        var builder = builder();
        var visibility = properties.getProperty(DEFAULT_VISIBILITY_KEY);
        if (visibility != null) {
            var parsed = Visibility.parse(visibility.trim());
            if (parsed == null) {
                throw new IllegalArgumentException("Invalid " + DEFAULT_VISIBILITY_KEY + ": " + visibility);
            }
            builder.defaultVisibility(parsed);
        }
        var timeout = properties.getProperty(ACCEPT_TIMEOUT_KEY);
        if (timeout != null) {
            try {
                builder.acceptTimeout(Duration.ofMillis(Long.parseLong(timeout.trim())));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid " + ACCEPT_TIMEOUT_KEY + ": " + timeout, e);
            }
        }
        var fair = properties.getProperty(FAIR_LOCKS_KEY);
        if (fair != null) {
            builder.fairLocks(Boolean.parseBoolean(fair.trim()));
        }
        return builder.build();
    }

    /**
     * Load {@value #RESOURCE} from the context class loader, or return the defaults when the
     * resource is absent.
     */
    public static TuplaConfiguration load() {
        var loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = TuplaConfiguration.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                return defaults();
            }
            var properties = new Properties();
            properties.load(in);
            return fromProperties(properties);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
    }

    /**
     * Get the visibility given to tables whose options leave it unset.
     *
     * @return default visibility (default: PROTECTED)
     */
    public Visibility defaultVisibility() {
        return defaultVisibility;
    }

    /**
     * Get the wait used by accept calls that do not pass a timeout.
     *
     * @return accept timeout (default: 5 seconds)
     */
    public Duration acceptTimeout() {
        return acceptTimeout;
    }

    /**
     * Check if table locks are created in fair mode.
     *
     * @return true if fair locks are used (default: false)
     */
    public boolean fairLocks() {
        return fairLocks;
    }

    /**
     * Builder for TuplaConfiguration.
     */
    public static class Builder {
        private Visibility defaultVisibility = Visibility.PROTECTED;
        private Duration acceptTimeout = Duration.ofSeconds(5);
        private boolean fairLocks = false;

        private Builder() {
        }

        public Builder defaultVisibility(Visibility defaultVisibility) {
            if (defaultVisibility == null) {
                throw new IllegalArgumentException("defaultVisibility required");
            }
            this.defaultVisibility = defaultVisibility;
            return this;
        }

        /**
         * Set the default accept wait.
         *
         * @param acceptTimeout non-negative wait
         * @return this builder for method chaining
         */
        public Builder acceptTimeout(Duration acceptTimeout) {
            if (acceptTimeout == null || acceptTimeout.isNegative()) {
                throw new IllegalArgumentException("acceptTimeout must be non-negative: " + acceptTimeout);
            }
            this.acceptTimeout = acceptTimeout;
            return this;
        }

        public Builder fairLocks(boolean fairLocks) {
            this.fairLocks = fairLocks;
            return this;
        }

        public TuplaConfiguration build() {
            return new TuplaConfiguration(this);
        }
    }
}
