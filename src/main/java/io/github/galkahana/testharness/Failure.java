package io.github.galkahana.testharness;

/**
 * A failed test, kept for the listing printed after all tests ran.
 *
 * @param test The failed test
 * @param message Message of the {@link Outcome.Failed} outcome, may be null
 */
public record Failure<D>(TestDescriptor<D> test, String message) {
}
