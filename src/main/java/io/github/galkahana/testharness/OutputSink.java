package io.github.galkahana.testharness;

import java.io.Closeable;
import java.io.Flushable;
import java.io.IOException;

/**
 * Text destination for the report that may be able to color text.
 * Only the coordinating thread of a run writes to a sink.
 */
public interface OutputSink extends Flushable, Closeable {

    void write(String text) throws IOException;

    /**
     * Color everything written until the next {@link #reset()}. No-op for sinks that cannot color.
     */
    void setColor(TextColor color) throws IOException;

    void reset() throws IOException;

    boolean supportsColor();
}
