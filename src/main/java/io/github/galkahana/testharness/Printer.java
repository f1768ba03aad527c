package io.github.galkahana.testharness;

import java.io.IOException;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Renders run events as a pretty (one line per test) or terse (one character per test) report.
 * <p>
 * Events must arrive in order: title, then for every test an announcement followed by its outcome, then
 * optionally the failure listing, then the summary. A listing request replaces all of them. Column widths
 * are computed up front from every test of the run so that lines align whatever the execution order.
 */
public class Printer implements AutoCloseable {

    enum State {
        IDLE, LISTED, TITLE_PRINTED, ANNOUNCING_TEST, OUTCOME_PRINTED, FAILURES_PRINTED, SUMMARY_PRINTED
    }

    private final OutputSink out;
    private final FormatSetting format;
    private final int nameWidth;
    private final int kindWidth;

    private State state = State.IDLE;

    /**
     * @param format Report format, must not be {@link FormatSetting#JSON}
     * @param tests Every test taking part in the run (after filtering), used for column widths
     * @param out Destination of the report
     * @throws ConfigurationException If the format is not implemented
     */
    public Printer(FormatSetting format, List<? extends TestDescriptor<?>> tests, OutputSink out) {
        checkFormat(format);
        this.out = out;
        this.format = format;

        // Code points are only an approximation of display width, good enough for most names.
        this.nameWidth = tests.stream()
                .mapToInt(test -> codePoints(test.name()))
                .max()
                .orElse(0);
        this.kindWidth = tests.stream()
                .mapToInt(test -> test.kind().isEmpty() ? 0 : codePoints(test.kind()) + 3)
                .max()
                .orElse(0);
    }

    /**
     * Reject formats the printer cannot render. Called before anything is opened or written.
     */
    public static void checkFormat(FormatSetting format) {
        if (format == FormatSetting.JSON) {
            throw new ConfigurationException("Output format 'json' is not implemented yet");
        }
    }

    /**
     * Print "name: test" or "name: bench" for each test instead of running them.
     */
    public void printList(List<? extends TestDescriptor<?>> tests) {
        transition(EnumSet.of(State.IDLE), State.LISTED);
        StringBuilder text = new StringBuilder();
        for (TestDescriptor<?> test : tests) {
            text.append(kindLabel(test.kind()))
                    .append(test.name())
                    .append(": ")
                    .append(test.bench() ? "bench" : "test")
                    .append('\n');
        }
        write(text.toString());
        flush();
    }

    /**
     * Print the first line, e.g. "running 3 tests".
     */
    public void printTitle(long numTests) {
        transition(EnumSet.of(State.IDLE), State.TITLE_PRINTED);
        write("\nrunning " + numTests + " test" + (numTests == 1 ? "" : "s") + "\n");
    }

    /**
     * Announce a test, e.g. "test [kind] name ... ". Prints nothing in terse mode.
     */
    public void printTest(TestDescriptor<?> test) {
        transition(EnumSet.of(State.TITLE_PRINTED, State.OUTCOME_PRINTED), State.ANNOUNCING_TEST);
        if (format == FormatSetting.PRETTY) {
            write("test " + pad(kindLabel(test.kind()), kindWidth) + pad(test.name(), nameWidth) + " ... ");
        }
    }

    /**
     * Print the outcome of the announced test: a word and a line break in pretty mode, one character in
     * terse mode.
     */
    public void printOutcome(Outcome outcome) {
        transition(EnumSet.of(State.ANNOUNCING_TEST), State.OUTCOME_PRINTED);
        if (format == FormatSetting.PRETTY) {
            printOutcomePretty(outcome);
            if (outcome instanceof Outcome.Measured measured) {
                write(String.format(Locale.ROOT, ": %11s ns/iter (+/- %s)",
                        thousands(measured.averageNanos()), thousands(measured.varianceNanos())));
            }
            write("\n");
        } else {
            colored(terseChar(outcome), colorOf(outcome));
        }
    }

    /**
     * Print every failed test with its message, then the names of all failed tests.
     */
    public void printFailures(List<? extends Failure<?>> failures) {
        transition(EnumSet.of(State.TITLE_PRINTED, State.OUTCOME_PRINTED), State.FAILURES_PRINTED);
        StringBuilder text = new StringBuilder("\nfailures:\n\n");
        for (Failure<?> failure : failures) {
            text.append("---- ").append(failure.test().name()).append(" ----\n");
            if (failure.message() != null) {
                text.append(failure.message()).append('\n');
            }
            text.append('\n');
        }
        text.append("\nfailures:\n");
        for (Failure<?> failure : failures) {
            text.append("    ").append(failure.test().name()).append('\n');
        }
        write(text.toString());
    }

    /**
     * Print the closing "test result: ..." line.
     */
    public void printSummary(RunSummary summary) {
        transition(EnumSet.of(State.TITLE_PRINTED, State.OUTCOME_PRINTED, State.FAILURES_PRINTED),
                State.SUMMARY_PRINTED);
        write("\ntest result: ");
        if (summary.hasFailed()) {
            colored("FAILED", TextColor.RED);
        } else {
            colored("ok", TextColor.GREEN);
        }
        write(String.format(Locale.ROOT, ". %d passed; %d failed; %d ignored; %d measured; %d filtered out\n\n",
                summary.numPassed(),
                summary.numFailed(),
                summary.numIgnored(),
                summary.numMeasured(),
                summary.numFilteredOut()));
        flush();
    }

    public void flush() {
        try {
            out.flush();
        } catch (IOException e) {
            throw new SinkException("Failed to flush report output", e);
        }
    }

    @Override
    public void close() {
        try {
            out.close();
        } catch (IOException e) {
            throw new SinkException("Failed to close report output", e);
        }
    }

    State state() {
        return state;
    }

    private void transition(Set<State> from, State to) {
        if (!from.contains(state)) {
            throw new IllegalStateException("Cannot move from " + state + " to " + to);
        }
        state = to;
    }

    private void printOutcomePretty(Outcome outcome) {
        String word;
        if (outcome instanceof Outcome.Passed) word = "ok";
        else if (outcome instanceof Outcome.Failed) word = "FAILED";
        else if (outcome instanceof Outcome.Ignored) word = "ignored";
        else word = "bench";
        colored(word, colorOf(outcome));
    }

    private static String terseChar(Outcome outcome) {
        if (outcome instanceof Outcome.Passed) return ".";
        if (outcome instanceof Outcome.Failed) return "F";
        if (outcome instanceof Outcome.Ignored) return "i";
        return "b";
    }

    private static TextColor colorOf(Outcome outcome) {
        if (outcome instanceof Outcome.Passed) return TextColor.GREEN;
        if (outcome instanceof Outcome.Failed) return TextColor.RED;
        if (outcome instanceof Outcome.Ignored) return TextColor.YELLOW;
        return TextColor.CYAN;
    }

    private void colored(String text, TextColor color) {
        try {
            out.setColor(color);
            out.write(text);
            out.reset();
        } catch (IOException e) {
            throw new SinkException("Failed to write report output", e);
        }
    }

    private void write(String text) {
        try {
            out.write(text);
        } catch (IOException e) {
            throw new SinkException("Failed to write report output", e);
        }
    }

    private static String kindLabel(String kind) {
        return kind.isEmpty() ? "" : "[" + kind + "] ";
    }

    private static String pad(String text, int width) {
        int missing = width - codePoints(text);
        return missing > 0 ? text + " ".repeat(missing) : text;
    }

    private static int codePoints(String text) {
        return text.codePointCount(0, text.length());
    }

    private static String thousands(long value) {
        return String.format(Locale.ROOT, "%,d", value);
    }
}
