package io.github.galkahana.testharness;

/**
 * Coloring policy for outcome tokens.
 */
public enum ColorSetting {
    /** Colorize when writing to an interactive terminal. */
    AUTO,
    ALWAYS,
    NEVER
}
