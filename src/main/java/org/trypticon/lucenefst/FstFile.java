package org.trypticon.lucenefst;

import org.trypticon.lucenefst.internal.lucene.codecs.CodecUtil;
import org.trypticon.lucenefst.internal.lucene.store.DataInput;
import org.trypticon.lucenefst.internal.lucene.store.DataOutput;
import org.trypticon.lucenefst.internal.lucene.store.FileChannelIndexInput;
import org.trypticon.lucenefst.internal.lucene.store.IndexInput;
import org.trypticon.lucenefst.internal.lucene.store.InputStreamDataInput;
import org.trypticon.lucenefst.internal.lucene.store.OutputStreamDataOutput;
import org.trypticon.lucenefst.internal.lucene.util.BytesRef;
import org.trypticon.lucenefst.internal.lucene.util.IntsRefBuilder;
import org.trypticon.lucenefst.internal.lucene.util.fst.FST;
import org.trypticon.lucenefst.internal.lucene.util.fst.FSTCompiler;
import org.trypticon.lucenefst.internal.lucene.util.fst.OffHeapFSTStore;
import org.trypticon.lucenefst.internal.lucene.util.fst.Util;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * An FST stored in a file together with the format of its values.
 *
 * @param <T> the output type.
 */
public class FstFile<T> implements Closeable {
    static final String CODEC_NAME = "FSTFILE";
    static final int VERSION_START = 0;
    static final int VERSION_CURRENT = 0;

    private static final String COMPONENT = "FstFile";

    @Nonnull
    private final OutputFormat<T> format;

    @Nonnull
    private final FST<T> fst;

    @Nullable
    private final IndexInput input;

    private FstFile(@Nonnull OutputFormat<T> format, @Nonnull FST<T> fst, @Nullable IndexInput input) {
        this.format = format;
        this.fst = fst;
        this.input = input;
    }

    /**
     * Builds an FST from a text file with one {@code key<TAB>value} entry per line,
     * sorted by the UTF-8 bytes of the keys.
     *
     * @param text the text file.
     * @param format the format of the values.
     * @param infoStream an info stream to log to.
     * @param <T> the output type.
     * @return the built FST file, held in memory.
     * @throws IOException if an error occurs reading the text, or if the text is malformed.
     */
    public static <T> FstFile<T> build(@Nonnull Path text, @Nonnull OutputFormat<T> format,
                                       @Nonnull InfoStream infoStream) throws IOException {
        if (infoStream.isEnabled(COMPONENT)) {
            infoStream.message(COMPONENT, "Building " + format + " FST from " + text);
        }
        FSTCompiler<T> compiler = new FSTCompiler.Builder<>(FST.INPUT_TYPE.BYTE1, format.getOutputs())
                .infoStream(infoStream)
                .build();
        IntsRefBuilder scratch = new IntsRefBuilder();
        BytesRef lastKey = null;
        int lineNumber = 0;
        try (BufferedReader reader = Files.newBufferedReader(text, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isEmpty()) {
                    continue;
                }
                int tab = line.indexOf('\t');
                if (tab < 0) {
                    throw new IOException("Missing tab at line " + lineNumber + " of: " + text);
                }
                BytesRef key = new BytesRef(line.substring(0, tab));
                if (lastKey != null) {
                    int cmp = key.compareTo(lastKey);
                    if (cmp < 0) {
                        throw new IOException("Key out of order at line " + lineNumber + " of: " + text);
                    } else if (cmp == 0) {
                        throw new IOException("Duplicate key at line " + lineNumber + " of: " + text);
                    }
                }
                T value;
                try {
                    value = format.parse(line.substring(tab + 1));
                } catch (IllegalArgumentException e) {
                    throw new IOException("Bad value at line " + lineNumber + " of: " + text, e);
                }
                compiler.add(Util.toIntsRef(key, scratch), value);
                lastKey = key;
            }
        }
        FST<T> fst = compiler.compile();
        if (fst == null) {
            throw new IOException("No entries found in: " + text);
        }
        return new FstFile<>(format, fst, null);
    }

    /**
     * Reads an FST file fully into memory.
     *
     * @param path the file.
     * @param infoStream an info stream to log to.
     * @return the FST file.
     * @throws IOException if an error occurs reading, or the file is not a known FST file.
     */
    public static FstFile<?> read(@Nonnull Path path, @Nonnull InfoStream infoStream) throws IOException {
        try (InputStream stream = new BufferedInputStream(Files.newInputStream(path))) {
            DataInput in = new InputStreamDataInput(stream);
            OutputFormat<?> format = readHeader(in);
            FstFile<?> file = load(format, in, null);
            if (infoStream.isEnabled(COMPONENT)) {
                infoStream.message(COMPONENT, "Loaded " + file.fst.numBytes() + " bytes on heap from " + path);
            }
            return file;
        }
    }

    /**
     * Opens an FST file, leaving the FST bytes on disk. The returned file must be closed.
     *
     * @param path the file.
     * @param infoStream an info stream to log to.
     * @return the FST file.
     * @throws IOException if an error occurs reading, or the file is not a known FST file.
     */
    public static FstFile<?> openOffHeap(@Nonnull Path path, @Nonnull InfoStream infoStream) throws IOException {
        IndexInput in = FileChannelIndexInput.open(path);
        boolean success = false;
        try {
            OutputFormat<?> format = readHeader(in);
            FstFile<?> file = load(format, in, in);
            if (infoStream.isEnabled(COMPONENT)) {
                infoStream.message(COMPONENT, "Opened " + file.fst.numBytes() + " bytes off heap from " + path);
            }
            success = true;
            return file;
        } finally {
            if (!success) {
                in.close();
            }
        }
    }

    private static OutputFormat<?> readHeader(DataInput in) throws IOException {
        CodecUtil.checkHeader(in, CODEC_NAME, VERSION_START, VERSION_CURRENT);
        return OutputFormat.forId(in.readByte() & 0xFF);
    }

    private static <T> FstFile<T> load(OutputFormat<T> format, DataInput in, @Nullable IndexInput offHeapInput)
            throws IOException {
        FST<T> fst;
        if (offHeapInput != null) {
            fst = new FST<>(in, in, format.getOutputs(), new OffHeapFSTStore());
        } else {
            fst = new FST<>(in, in, format.getOutputs());
        }
        return new FstFile<>(format, fst, offHeapInput);
    }

    /**
     * Saves this FST file.
     *
     * @param path the file to write.
     * @throws IOException if an error occurs writing.
     */
    public void save(@Nonnull Path path) throws IOException {
        try (OutputStream stream = new BufferedOutputStream(Files.newOutputStream(path))) {
            DataOutput out = new OutputStreamDataOutput(stream);
            CodecUtil.writeHeader(out, CODEC_NAME, VERSION_CURRENT);
            out.writeByte((byte) format.getId());
            fst.save(out, out);
        }
    }

    /**
     * Looks up the value for a key.
     *
     * @param key the key.
     * @return the value. Returns {@code null} if the key is not present.
     * @throws IOException if an error occurs reading.
     */
    @Nullable
    public T get(@Nonnull String key) throws IOException {
        return Util.get(fst, new BytesRef(key));
    }

    @Nonnull
    public OutputFormat<T> getFormat() {
        return format;
    }

    @Nonnull
    public FST<T> getFst() {
        return fst;
    }

    /**
     * Tests whether the FST bytes are read from disk on demand.
     *
     * @return {@code true} if opened off heap.
     */
    public boolean isOffHeap() {
        return input != null;
    }

    @Override
    public void close() throws IOException {
        if (input != null) {
            input.close();
        }
    }
}
