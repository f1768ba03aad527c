package io.github.galkahana.testharness;

import java.nio.file.Path;
import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Resolved options for a single run. Built once, before selection, and never changed afterwards.
 * <p>
 * {@code RunConfiguration.builder().build()} gives the defaults: no filter, everything not ignored runs
 * sequentially, pretty output on standard output with automatic coloring.
 */
@Value
@Builder(toBuilder = true)
public class RunConfiguration {

    /** Only tests whose name contains (or equals, with {@link #exact}) this string run. Null for no filter. */
    String filter;

    /** Match the filter and skip patterns against the whole name instead of a substring. */
    boolean exact;

    /** Tests whose name matches any of these are filtered out. */
    @Singular
    List<String> skipPatterns;

    /** Run ignored tests together with the others. */
    boolean includeIgnored;

    /** Run only the ignored tests. */
    boolean ignoredOnly;

    /** Run tests and ignore benchmarks. */
    boolean testOnly;

    /** Run benchmarks and ignore tests. */
    boolean benchOnly;

    /** Print the selected tests instead of running them. */
    boolean list;

    /** Worker pool size. Null, 0 or 1 runs everything on the calling thread. */
    Integer numWorkers;

    @Builder.Default
    FormatSetting format = FormatSetting.PRETTY;

    @Builder.Default
    ColorSetting color = ColorSetting.AUTO;

    /** Write the report to this file instead of standard output. */
    Path logfile;

    public boolean isSequential() {
        return numWorkers == null || numWorkers <= 1;
    }
}
