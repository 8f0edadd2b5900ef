package org.trypticon.lucenefst.cli;

/**
 * Constants shared by the CLI.
 */
class Constants {
    /**
     * The name the tool is run as.
     */
    static final String APP_NAME = "lucene-fst";

    static final String VERBOSE_FLAG = "--verbose";

    static final String OFF_HEAP_FLAG = "--off-heap";

    private Constants() {
    }
}
