package io.github.galkahana.testharness;

/**
 * The run configuration asks for something the harness cannot do. Raised before any output is written.
 */
public class ConfigurationException extends HarnessException {

    public ConfigurationException(String message) {
        super(message);
    }
}
