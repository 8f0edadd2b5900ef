package org.trypticon.lucenefst;

import org.trypticon.lucenefst.internal.lucene.util.BytesRef;
import org.trypticon.lucenefst.internal.lucene.util.fst.ByteSequenceOutputs;
import org.trypticon.lucenefst.internal.lucene.util.fst.Outputs;
import org.trypticon.lucenefst.internal.lucene.util.fst.PositiveIntOutputs;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * The kinds of values an FST file can map its keys to.
 *
 * @param <T> the output type.
 */
public abstract class OutputFormat<T> {

    /**
     * Non-negative integer values.
     */
    public static final OutputFormat<Long> INTS = new OutputFormat<Long>(0, "ints", PositiveIntOutputs.getSingleton()) {
        @Override
        public Long parse(@Nonnull String text) {
            long value;
            try {
                value = Long.parseLong(text);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Not a number: " + text, e);
            }
            if (value < 0) {
                throw new IllegalArgumentException("Value must not be negative: " + text);
            }
            return value;
        }

        @Override
        public String format(@Nonnull Long value) {
            return Long.toString(value);
        }
    };

    /**
     * Byte string values, given and shown as UTF-8 text.
     */
    public static final OutputFormat<BytesRef> BYTES = new OutputFormat<BytesRef>(1, "bytes", ByteSequenceOutputs.getSingleton()) {
        @Override
        public BytesRef parse(@Nonnull String text) {
            return new BytesRef(text);
        }

        @Override
        public String format(@Nonnull BytesRef value) {
            return value.utf8ToString();
        }
    };

    private static final OutputFormat<?>[] formats = { INTS, BYTES };

    private final int id;
    private final String name;
    private final Outputs<T> outputs;

    private OutputFormat(int id, String name, Outputs<T> outputs) {
        this.id = id;
        this.name = name;
        this.outputs = outputs;
    }

    /**
     * Gets the id stored in FST files using this format.
     *
     * @return the id.
     */
    public int getId() {
        return id;
    }

    /**
     * Gets the name used for this format on the command line.
     *
     * @return the name.
     */
    public String getName() {
        return name;
    }

    /**
     * Gets the output algebra for this format.
     *
     * @return the outputs.
     */
    public Outputs<T> getOutputs() {
        return outputs;
    }

    /**
     * Parses a value from its text form.
     *
     * @param text the text.
     * @return the value.
     * @throws IllegalArgumentException if the text is not a valid value.
     */
    public abstract T parse(@Nonnull String text);

    /**
     * Formats a value as text.
     *
     * @param value the value.
     * @return the text.
     */
    public abstract String format(@Nonnull T value);

    /**
     * Finds the format with the given id.
     *
     * @param id the id read from a file.
     * @return the format.
     * @throws UnknownFormatException if no format has that id.
     */
    public static OutputFormat<?> forId(int id) throws UnknownFormatException {
        for (OutputFormat<?> format : formats) {
            if (format.id == id) {
                return format;
            }
        }
        throw new UnknownFormatException("Unknown output format id: " + id);
    }

    /**
     * Tries to find a format by name.
     *
     * @param name the name.
     * @return the format. Returns {@code null} if not found.
     */
    @Nullable
    public static OutputFormat<?> findByName(String name) {
        for (OutputFormat<?> format : formats) {
            if (format.name.equals(name)) {
                return format;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return name;
    }
}
