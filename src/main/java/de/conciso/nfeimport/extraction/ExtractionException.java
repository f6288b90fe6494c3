package de.conciso.nfeimport.extraction;

import de.conciso.nfeimport.IngestionException;

/**
 * Thrown when a well-formed document does not have the NF-e shape the extractor expects,
 * e.g. text where a block is required or a non-numeric amount.
 */
public class ExtractionException extends IngestionException {

    public ExtractionException(String message) {
        super(Stage.EXTRACTION, message, null);
    }

    public ExtractionException(String message, Throwable cause) {
        super(Stage.EXTRACTION, message, cause);
    }
}
