package io.github.galkahana.testharness;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import lombok.extern.slf4j.Slf4j;

/**
 * Opens the report destination described by a {@link RunConfiguration}.
 */
@Slf4j
public final class OutputSinks {

    private OutputSinks() {
    }

    /**
     * Open the logfile if one is configured, standard output otherwise.
     * A logfile is only colored with {@link ColorSetting#ALWAYS}. Standard output is never closed by the
     * returned sink.
     *
     * @throws SinkException If the logfile cannot be created
     */
    public static OutputSink open(RunConfiguration config) {
        Path logfile = config.getLogfile();
        if (logfile != null) {
            Writer writer;
            try {
                writer = Files.newBufferedWriter(logfile, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new SinkException("Failed to create logfile " + logfile, e);
            }
            boolean colored = config.getColor() == ColorSetting.ALWAYS;
            log.debug("Writing report to {} (colored={})", logfile, colored);
            return colored ? new AnsiSink(writer) : new PlainSink(writer);
        }

        Writer stdout = new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
        boolean colored = useColor(config.getColor(), System.console() != null,
                System.getenv("TERM"), System.getenv("NO_COLOR"));
        log.debug("Writing report to standard output (colored={})", colored);
        return colored ? new AnsiSink(stdout, false) : new PlainSink(stdout, false);
    }

    static boolean useColor(ColorSetting setting, boolean interactive, String term, String noColor) {
        switch (setting) {
            case ALWAYS:
                return true;
            case NEVER:
                return false;
            default:
                return interactive && !"dumb".equals(term) && noColor == null;
        }
    }
}
