package io.github.galkahana.testharness;

import java.io.IOException;
import java.io.Writer;

/**
 * Sink that writes text as is and drops color requests.
 */
public class PlainSink implements OutputSink {

    private final Writer out;
    private final boolean closeUnderlying;

    public PlainSink(Writer out) {
        this(out, true);
    }

    /**
     * @param out Destination writer
     * @param closeUnderlying Whether {@link #close()} closes {@code out} or only flushes it
     */
    public PlainSink(Writer out, boolean closeUnderlying) {
        this.out = out;
        this.closeUnderlying = closeUnderlying;
    }

    @Override
    public void write(String text) throws IOException {
        out.write(text);
    }

    @Override
    public void setColor(TextColor color) throws IOException {
    }

    @Override
    public void reset() throws IOException {
    }

    @Override
    public boolean supportsColor() {
        return false;
    }

    @Override
    public void flush() throws IOException {
        out.flush();
    }

    @Override
    public void close() throws IOException {
        if (closeUnderlying) out.close();
        else out.flush();
    }
}
