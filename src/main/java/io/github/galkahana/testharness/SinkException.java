package io.github.galkahana.testharness;

import java.io.IOException;

/**
 * The report destination could not be opened or written.
 */
public class SinkException extends HarnessException {

    public SinkException(String message, IOException cause) {
        super(message, cause);
    }
}
