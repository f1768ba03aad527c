package io.github.galkahana.testharness;

import java.io.IOException;
import java.io.Writer;

/**
 * Sink that colors text with ANSI escape sequences.
 */
public class AnsiSink extends PlainSink {

    static final String ESCAPE = "\u001B[";
    static final String RESET = ESCAPE + "0m";

    private final Writer out;

    public AnsiSink(Writer out) {
        this(out, true);
    }

    public AnsiSink(Writer out, boolean closeUnderlying) {
        super(out, closeUnderlying);
        this.out = out;
    }

    @Override
    public void setColor(TextColor color) throws IOException {
        out.write(ESCAPE + color.sgrCode() + "m");
    }

    @Override
    public void reset() throws IOException {
        out.write(RESET);
    }

    @Override
    public boolean supportsColor() {
        return true;
    }
}
