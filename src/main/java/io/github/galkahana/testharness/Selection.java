package io.github.galkahana.testharness;

/**
 * How the {@link Selector} treats a descriptor in a run.
 */
public enum Selection {
    /** Removed from the run. Only counted in the filtered out total. */
    FILTERED_OUT,
    /** Part of the run and reported, but never evaluated. */
    IGNORED,
    RUNNABLE
}
