package org.trypticon.lucenefst.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;

import org.trypticon.lucenefst.FstFile;
import org.trypticon.lucenefst.InfoStream;

/**
 * Command to show info about an FST file.
 */
class InfoCommand extends Command {
    InfoCommand() {
        super("info", "Gives info about an FST file", "[--verbose] <fst file>");
    }

    @Override
    int run(List<String> args, PrintStream out, PrintStream err) {
        args = mutableCopy(args);
        InfoStream infoStream = infoStream(args, err);
        if (args.size() != 1) {
            usage(err);
            return 1;
        }
        Path path = Path.of(args.get(0));
        try {
            FstFile<?> file = FstFile.read(path, infoStream);
            out.println("Output format: " + file.getFormat());
            out.println("Input type: " + file.getFst().getInputType());
            out.println("Size: " + file.getFst().numBytes() + " bytes");
            out.println("Accepts empty key: " + (file.getFst().getEmptyOutput() != null ? "yes" : "no"));
            return 0;
        } catch (IOException e) {
            err.println("Error getting info for FST file at: " + path);
            printErrorSummary(err, e);
            return 1;
        }
    }
}
