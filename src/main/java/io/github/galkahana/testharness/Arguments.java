package io.github.galkahana.testharness;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import picocli.CommandLine;

/**
 * Command line options understood by the harness, a subset of what the standard test harness accepts.
 * <p>
 * Use {@link #parse(String...)} and then {@link #toConfiguration()} to get a {@link RunConfiguration}.
 */
@CommandLine.Command(
        name = "test-harness",
        usageHelpAutoWidth = true,
        footer = "%nBy default all tests run sequentially. Use --test-threads with a value above 1 to run them in parallel.")
public class Arguments {

    @CommandLine.Option(names = "--include-ignored", description = "Run ignored and not ignored tests")
    boolean includeIgnored;

    @CommandLine.Option(names = "--ignored", description = "Run only ignored tests")
    boolean ignored;

    @CommandLine.Option(names = "--test", description = "Run tests and not benchmarks")
    boolean test;

    @CommandLine.Option(names = "--bench", description = "Run benchmarks instead of tests")
    boolean bench;

    @CommandLine.Option(names = "--list", description = "List all tests and benchmarks")
    boolean list;

    @CommandLine.Option(names = "--nocapture", description = "No-op, output of tests is never captured")
    boolean nocapture;

    @CommandLine.Option(names = "--exact", description = "Exactly match filters rather than by substring")
    boolean exact;

    @CommandLine.Option(names = {"-q", "--quiet"},
            description = "Display one character per test instead of one line. Alias to --format=terse")
    boolean quiet;

    @CommandLine.Option(names = "--test-threads", paramLabel = "N",
            description = "Number of threads used for running tests in parallel. 0 or 1 runs all tests on the main thread")
    Integer testThreads;

    @CommandLine.Option(names = "--logfile", paramLabel = "PATH",
            description = "Write logs to the specified file instead of stdout")
    Path logfile;

    @CommandLine.Option(names = "--skip", paramLabel = "FILTER",
            description = "Skip tests whose names contain FILTER (this flag can be used multiple times)")
    List<String> skip = new ArrayList<>();

    @CommandLine.Option(names = "--color", paramLabel = "auto|always|never",
            description = "Configure coloring of output: auto (default), always or never")
    ColorSetting color;

    @CommandLine.Option(names = "--format", paramLabel = "pretty|terse|json",
            description = "Configure formatting of output: pretty (default), terse or json")
    FormatSetting format;

    @CommandLine.Parameters(index = "0", arity = "0..1", paramLabel = "FILTER",
            description = "Only tests whose names contain FILTER are run")
    String filter;

    /**
     * Parse the given arguments. The program name must not be included.
     *
     * @throws CommandLine.ParameterException If the arguments are malformed
     */
    public static Arguments parse(String... args) {
        Arguments arguments = new Arguments();
        commandLine(arguments).parseArgs(args);
        return arguments;
    }

    /**
     * Help text describing all options.
     */
    public static String usage() {
        return commandLine(new Arguments()).getUsageMessage();
    }

    private static CommandLine commandLine(Arguments arguments) {
        return new CommandLine(arguments).setCaseInsensitiveEnumValuesAllowed(true);
    }

    /**
     * Resolve the parsed options into a configuration.
     *
     * @throws ConfigurationException If mutually exclusive options were combined or a value is out of range
     */
    public RunConfiguration toConfiguration() {
        if (test && bench) {
            throw new ConfigurationException("--test and --bench cannot be used together");
        }
        if (ignored && includeIgnored) {
            throw new ConfigurationException("--ignored and --include-ignored cannot be used together");
        }
        if (quiet && format != null) {
            throw new ConfigurationException("--quiet and --format cannot be used together");
        }
        if (testThreads != null && testThreads < 0) {
            throw new ConfigurationException("--test-threads must not be negative, got " + testThreads);
        }

        FormatSetting resolvedFormat = quiet ? FormatSetting.TERSE : format;
        RunConfiguration.RunConfigurationBuilder builder = RunConfiguration.builder()
                .filter(filter)
                .exact(exact)
                .skipPatterns(skip)
                .includeIgnored(includeIgnored)
                .ignoredOnly(ignored)
                .testOnly(test)
                .benchOnly(bench)
                .list(list)
                .numWorkers(testThreads)
                .logfile(logfile);
        if (resolvedFormat != null) builder.format(resolvedFormat);
        if (color != null) builder.color(color);
        return builder.build();
    }
}
