package org.trypticon.lucenefst;

/**
 * Abstraction of a stream for diagnostic information. Shaped like Lucene's own
 * so that the internal code can report through it unchanged.
 */
public interface InfoStream {

    /**
     * An info stream which logs to nowhere.
     */
    InfoStream NO_OUTPUT = new InfoStream() {
        @Override
        public void message(String component, String line) {

        }

        @Override
        public boolean isEnabled(String component) {
            return false;
        }
    };

    /**
     * Logs a message for a component.
     *
     * @param component the component name.
     * @param line the message line.
     */
    void message(String component, String line);

    /**
     * Tests whether a message for a given component will be logged.
     *
     * @param component the component name.
     * @return {@code true} if messages for that component will be logged.
     */
    boolean isEnabled(String component);
}
