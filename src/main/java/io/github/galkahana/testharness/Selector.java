package io.github.galkahana.testharness;

/**
 * Decides what happens to each descriptor in a run.
 * <p>
 * Filtering is decided first and independently of the ignore and benchmark flags, so that name filters
 * and skip patterns remove tests from every count before ignore rules apply.
 */
public class Selector {

    private final RunConfiguration config;

    public Selector(RunConfiguration config) {
        this.config = config;
    }

    public Selection classify(TestDescriptor<?> test) {
        if (isFilteredOut(test)) return Selection.FILTERED_OUT;
        if (isIgnored(test)) return Selection.IGNORED;
        return Selection.RUNNABLE;
    }

    /**
     * Whether the descriptor is excluded by the name filter, a skip pattern, or because only ignored tests
     * were requested and it is not one of them.
     */
    public boolean isFilteredOut(TestDescriptor<?> test) {
        String filter = config.getFilter();
        if (filter != null && !matches(test.name(), filter)) return true;

        for (String skip : config.getSkipPatterns()) {
            if (matches(test.name(), skip)) return true;
        }

        return config.isIgnoredOnly() && !test.ignored();
    }

    /**
     * Whether a descriptor that survived filtering is reported as ignored instead of being evaluated.
     */
    public boolean isIgnored(TestDescriptor<?> test) {
        return (test.ignored() && !config.isIncludeIgnored() && !config.isIgnoredOnly())
                || (test.bench() && config.isTestOnly())
                || (!test.bench() && config.isBenchOnly());
    }

    private boolean matches(String name, String pattern) {
        return config.isExact() ? name.equals(pattern) : name.contains(pattern);
    }
}
