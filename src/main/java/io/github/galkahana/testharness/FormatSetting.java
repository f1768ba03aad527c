package io.github.galkahana.testharness;

/**
 * Report format.
 */
public enum FormatSetting {
    /** One line per test. Output for humans. */
    PRETTY,
    /** One character per test, for suites with many tests. */
    TERSE,
    /** Machine readable events. Accepted on the command line but not implemented yet. */
    JSON
}
