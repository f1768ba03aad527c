package io.github.galkahana.testharness;

/**
 * The evaluation function crashed instead of returning an outcome. The run is aborted.
 */
public class TestExecutionException extends HarnessException {

    private final String testName;

    public TestExecutionException(String testName, String message, Throwable cause) {
        super("Test '" + testName + "' " + message, cause);
        this.testName = testName;
    }

    public String getTestName() {
        return testName;
    }
}
