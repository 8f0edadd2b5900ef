package org.trypticon.lucenefst;

import org.trypticon.lucenefst.internal.lucene.index.CorruptIndexException;

/**
 * Specific exception thrown when stored data carries a format version or format id we don't know how to read.
 */
public class UnknownFormatException extends CorruptIndexException {
    public UnknownFormatException(String message) {
        super(message, "unknown format");
    }
}
