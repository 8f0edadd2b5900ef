package org.trypticon.lucenefst.cli;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

import org.trypticon.lucenefst.InfoStream;
import org.trypticon.lucenefst.PrintStreamInfoStream;

/**
 * Base class for CLI commands.
 */
abstract class Command {
    private final String name;
    private final String description;
    private final String usage;

    /**
     * Constructs the command.
     *
     * @param name a short name for the command.
     * @param description a description of the command.
     * @param usage usage summary of arguments to the command.
     */
    protected Command(String name, String description, String usage) {
        this.name = name;
        this.description = description;
        this.usage = usage;
    }

    /**
     * Gets the name of the command.
     *
     * @return the name of the command.
     */
    public String getName() {
        return name;
    }

    /**
     * Gets a description of the command.
     *
     * @return a description of the command.
     */
    public String getDescription() {
        return description;
    }

    /**
     * Prints usage info for this command.
     *
     * @param err the error stream.
     */
    void usage(PrintStream err) {
        err.println("usage: " + Constants.APP_NAME + " " + name + " " + usage);
    }

    /**
     * Runs the command.
     *
     * @param args the arguments to the command.
     * @param out the output stream.
     * @param err the error stream.
     * @return the result of the command.
     */
    abstract int run(List<String> args, PrintStream out, PrintStream err);

    /**
     * Prints a summary of the given exception.
     *
     * @param err the error stream.
     * @param e the exception.
     */
    static void printErrorSummary(PrintStream err, Exception e) {
        Throwable temp = e;
        while (temp != null) {
            err.println(temp);
            temp = temp.getCause();
        }
    }

    /**
     * Removes every occurrence of a flag from the arguments.
     *
     * @param args the arguments, which are modified.
     * @param flag the flag.
     * @return {@code true} if the flag was present.
     */
    static boolean removeFlag(List<String> args, String flag) {
        return args.removeIf(flag::equals);
    }

    /**
     * Removes the verbose flag from the arguments and picks the info stream it asks for.
     *
     * @param args the arguments, which are modified.
     * @param err the error stream, where verbose output goes.
     * @return the info stream.
     */
    static InfoStream infoStream(List<String> args, PrintStream err) {
        return removeFlag(args, Constants.VERBOSE_FLAG) ? new PrintStreamInfoStream(err) : InfoStream.NO_OUTPUT;
    }

    /**
     * Copies arguments into a list which the flag helpers may modify.
     *
     * @param args the arguments.
     * @return a mutable copy.
     */
    static List<String> mutableCopy(List<String> args) {
        return new ArrayList<>(args);
    }
}
