package org.javai.casebook.casefile;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Thrown when a case file cannot be written anywhere.
 *
 * <p>This escapes the guard that was recovering the failure: losing the case file
 * silently would defeat its purpose, so the fault is never classified.
 */
public class CaseFileException extends UncheckedIOException {

    public CaseFileException(String message, IOException cause) {
        super(message, cause);
    }
}
