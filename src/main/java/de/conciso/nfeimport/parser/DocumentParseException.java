package de.conciso.nfeimport.parser;

import de.conciso.nfeimport.IngestionException;

/**
 * Thrown when a file is not well-formed XML.
 */
public class DocumentParseException extends IngestionException {

    public DocumentParseException(String message, Throwable cause) {
        super(Stage.PARSE, message, cause);
    }
}
