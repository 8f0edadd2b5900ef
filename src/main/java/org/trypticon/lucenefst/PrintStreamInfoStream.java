package org.trypticon.lucenefst;

import java.io.PrintStream;

import javax.annotation.Nonnull;

/**
 * Info stream which prints every message to a print stream as {@code component: line}.
 */
public class PrintStreamInfoStream implements InfoStream {
    private final PrintStream stream;

    /**
     * Constructs the info stream.
     *
     * @param stream the stream to print to.
     */
    public PrintStreamInfoStream(@Nonnull PrintStream stream) {
        this.stream = stream;
    }

    @Override
    public void message(String component, String line) {
        stream.println(component + ": " + line);
    }

    @Override
    public boolean isEnabled(String component) {
        return true;
    }
}
