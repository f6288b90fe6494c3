package de.conciso.nfeimport;

import java.nio.file.Path;

import de.conciso.nfeimport.model.SourceFile;

/**
 * Result of one {@link IngestionPipeline#ingest} call.
 *
 * @param status      whether the document was committed or rejected
 * @param source      the file as it was found
 * @param accessKey   access key of a committed document, {@code null} when rejected
 * @param destination where the file ended up; {@code null} if a rejected file could not be moved
 * @param stage       failing stage of a rejected document, {@code null} for unexpected errors and commits
 * @param reason      failure message of a rejected document
 */
public record IngestionOutcome(
        Status status,
        SourceFile source,
        String accessKey,
        Path destination,
        IngestionException.Stage stage,
        String reason) {

    public enum Status { COMMITTED, REJECTED }

    static IngestionOutcome committed(SourceFile source, String accessKey, Path destination) {
        return new IngestionOutcome(Status.COMMITTED, source, accessKey, destination, null, null);
    }

    static IngestionOutcome rejected(SourceFile source, IngestionException.Stage stage, String reason, Path destination) {
        return new IngestionOutcome(Status.REJECTED, source, null, destination, stage, reason);
    }

    public boolean isCommitted() {
        return status == Status.COMMITTED;
    }
}
