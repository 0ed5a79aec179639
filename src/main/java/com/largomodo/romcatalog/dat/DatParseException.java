package com.largomodo.romcatalog.dat;

import java.io.IOException;

/**
 * Thrown when a DAT file is not well-formed enough to be read at all.
 * <p>
 * Individual malformed entries are skipped by the reader instead; this exception means
 * the document itself could not be parsed.
 */
public class DatParseException extends IOException {

    public DatParseException(String message) {
        super(message);
    }

    public DatParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
