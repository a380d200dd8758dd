package io.tupla.runtime;

import io.tupla.core.TuplaConfiguration;

/**
 * Entry point to the process-wide default arena.
 * <p>
 * The default arena is created on first use from {@link TuplaConfiguration#load()}, so a
 * {@code tupla.properties} resource on the classpath configures it.
 */
public final class Tupla {

    private Tupla() {
    }

    public static TuplaArena defaultArena() {
        return Holder.DEFAULT;
    }

    /**
     * Create a new isolated arena.
     */
    public static TuplaArena newArena(TuplaConfiguration configuration) {
        return new TuplaArena(configuration);
    }

    private static final class Holder {
        private static final TuplaArena DEFAULT = new TuplaArena(TuplaConfiguration.load());
    }
}
