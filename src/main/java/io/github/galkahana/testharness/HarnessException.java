package io.github.galkahana.testharness;

/**
 * Base type for errors that abort a test run. Failing tests are not errors, they are reported as
 * {@link Outcome.Failed}.
 */
public class HarnessException extends RuntimeException {

    public HarnessException(String message) {
        super(message);
    }

    public HarnessException(String message, Throwable cause) {
        super(message, cause);
    }
}
