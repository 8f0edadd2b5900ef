package org.trypticon.lucenefst.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;

import org.trypticon.lucenefst.FstFile;
import org.trypticon.lucenefst.InfoStream;
import org.trypticon.lucenefst.OutputFormat;

/**
 * Command to build an FST file from sorted text.
 */
class BuildCommand extends Command {
    BuildCommand() {
        super("build", "Builds an FST file from sorted key<TAB>value lines",
                "[--verbose] <text file> <fst file> [ints|bytes]");
    }

    @Override
    int run(List<String> args, PrintStream out, PrintStream err) {
        args = mutableCopy(args);
        InfoStream infoStream = infoStream(args, err);
        if (args.size() != 2 && args.size() != 3) {
            usage(err);
            return 1;
        }

        OutputFormat<?> format = OutputFormat.INTS;
        if (args.size() == 3) {
            format = OutputFormat.findByName(args.get(2));
            if (format == null) {
                err.println("Not a known output format: " + args.get(2));
                return 1;
            }
        }

        Path text = Path.of(args.get(0));
        Path destination = Path.of(args.get(1));
        try {
            FstFile<?> file = FstFile.build(text, format, infoStream);
            file.save(destination);
            out.println("Wrote " + format + " FST of " + file.getFst().numBytes() + " bytes to: " + destination);
            return 0;
        } catch (IOException e) {
            err.println("Error building FST from: " + text);
            printErrorSummary(err, e);
            return 1;
        }
    }
}
