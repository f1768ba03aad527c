package io.github.galkahana.testharness;

/**
 * Static description of a single test or benchmark.
 *
 * @param name Name of the test, displayed in the output and used for all filtering
 * @param kind Optional label printed in brackets before the name (e.g. {@code test [lint] foo}).
 *             Empty string means no kind
 * @param ignored Whether the test is skipped unless ignored tests are requested
 * @param bench Whether this is a benchmark rather than a plain test
 * @param data Caller owned data, never read by the harness
 * @param <D> Type of the caller owned data
 */
public record TestDescriptor<D>(String name, String kind, boolean ignored, boolean bench, D data) {

    public TestDescriptor {
        if (name == null || name.isEmpty()) throw new IllegalArgumentException("Test name must not be empty");
        if (kind == null) kind = "";
    }

    /**
     * Create a plain test with the given name, no kind and no data.
     */
    public static <D> TestDescriptor<D> test(String name) {
        return new TestDescriptor<>(name, "", false, false, null);
    }

    /**
     * Create a benchmark with the given name, no kind and no data.
     */
    public static <D> TestDescriptor<D> bench(String name) {
        return new TestDescriptor<>(name, "", false, true, null);
    }

    public TestDescriptor<D> withKind(String kind) {
        return new TestDescriptor<>(name, kind, ignored, bench, data);
    }

    public TestDescriptor<D> withIgnored(boolean ignored) {
        return new TestDescriptor<>(name, kind, ignored, bench, data);
    }

    public <T> TestDescriptor<T> withData(T data) {
        return new TestDescriptor<>(name, kind, ignored, bench, data);
    }
}
