package de.conciso.nfeimport;

/**
 * Base of every failure that rejects a single document.
 * The pipeline catches these and routes the offending file to the error folder.
 */
public abstract class IngestionException extends RuntimeException {

    public enum Stage { PARSE, EXTRACTION, PERSISTENCE, ROUTING }

    private final Stage stage;

    protected IngestionException(Stage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public Stage stage() {
        return stage;
    }
}
