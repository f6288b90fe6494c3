package de.conciso.nfeimport.routing;

import de.conciso.nfeimport.IngestionException;

/**
 * Thrown when a file cannot be moved into the processed or error folder.
 */
public class RoutingException extends IngestionException {

    public RoutingException(String message, Throwable cause) {
        super(Stage.ROUTING, message, cause);
    }
}
