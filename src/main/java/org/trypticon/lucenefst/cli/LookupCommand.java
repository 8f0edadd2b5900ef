package org.trypticon.lucenefst.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;

import org.trypticon.lucenefst.FstFile;
import org.trypticon.lucenefst.InfoStream;

/**
 * Command to look up keys in an FST file.
 */
class LookupCommand extends Command {
    LookupCommand() {
        super("lookup", "Looks up the values for keys", "[--verbose] [--off-heap] <fst file> <key...>");
    }

    @Override
    int run(List<String> args, PrintStream out, PrintStream err) {
        args = mutableCopy(args);
        InfoStream infoStream = infoStream(args, err);
        boolean offHeap = removeFlag(args, Constants.OFF_HEAP_FLAG);
        if (args.size() < 2) {
            usage(err);
            return 1;
        }
        Path path = Path.of(args.get(0));
        try (FstFile<?> file = offHeap ? FstFile.openOffHeap(path, infoStream) : FstFile.read(path, infoStream)) {
            for (String key : args.subList(1, args.size())) {
                printValue(out, file, key);
            }
            return 0;
        } catch (IOException e) {
            err.println("Error looking up keys in FST file at: " + path);
            printErrorSummary(err, e);
            return 1;
        }
    }

    private static <T> void printValue(PrintStream out, FstFile<T> file, String key) throws IOException {
        T value = file.get(key);
        if (value == null) {
            out.println(key + "\t(not found)");
        } else {
            out.println(key + "\t" + file.getFormat().format(value));
        }
    }
}
