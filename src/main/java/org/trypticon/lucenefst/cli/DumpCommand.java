package org.trypticon.lucenefst.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;

import org.trypticon.lucenefst.FstFile;
import org.trypticon.lucenefst.InfoStream;
import org.trypticon.lucenefst.internal.lucene.util.BytesRef;
import org.trypticon.lucenefst.internal.lucene.util.fst.BytesRefFSTEnum;

/**
 * Command to print the entries of an FST file in key order.
 */
class DumpCommand extends Command {
    DumpCommand() {
        super("dump", "Prints the entries of an FST file, optionally from a starting key",
                "[--verbose] [--off-heap] <fst file> [<from key>]");
    }

    @Override
    int run(List<String> args, PrintStream out, PrintStream err) {
        args = mutableCopy(args);
        InfoStream infoStream = infoStream(args, err);
        boolean offHeap = removeFlag(args, Constants.OFF_HEAP_FLAG);
        if (args.size() != 1 && args.size() != 2) {
            usage(err);
            return 1;
        }
        Path path = Path.of(args.get(0));
        String from = args.size() == 2 ? args.get(1) : null;
        try (FstFile<?> file = offHeap ? FstFile.openOffHeap(path, infoStream) : FstFile.read(path, infoStream)) {
            dump(out, file, from);
            return 0;
        } catch (IOException e) {
            err.println("Error dumping FST file at: " + path);
            printErrorSummary(err, e);
            return 1;
        }
    }

    private static <T> void dump(PrintStream out, FstFile<T> file, String from) throws IOException {
        BytesRefFSTEnum<T> fstEnum = new BytesRefFSTEnum<>(file.getFst());
        BytesRefFSTEnum.InputOutput<T> entry;
        if (from != null) {
            entry = fstEnum.seekCeil(new BytesRef(from));
        } else {
            entry = fstEnum.next();
        }
        while (entry != null) {
            out.println(entry.input.utf8ToString() + "\t" + file.getFormat().format(entry.output));
            entry = fstEnum.next();
        }
    }
}
