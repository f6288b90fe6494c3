package de.conciso.nfeimport.store;

import de.conciso.nfeimport.IngestionException;

public class DocumentStoreException extends IngestionException {

    public DocumentStoreException(String message, Throwable cause) {
        super(Stage.PERSISTENCE, message, cause);
    }
}
