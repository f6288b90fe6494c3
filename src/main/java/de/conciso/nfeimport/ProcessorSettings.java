package de.conciso.nfeimport;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Resolved processor configuration. All paths are absolute and normalized.
 *
 * @param xmlFolder       watched root receiving new documents
 * @param processedFolder destination of successfully imported files
 * @param errorFolder     destination of rejected files
 * @param databaseFile    SQLite database file
 * @param recursive       whether sub folders of {@code xmlFolder} are swept and watched
 * @param settleInterval  wait between noticing a new file and reading it
 * @param workers         number of concurrent ingest workers for live events
 * @param queueCapacity   pending live events before the watcher thread processes them itself
 */
public record ProcessorSettings(
        Path xmlFolder,
        Path processedFolder,
        Path errorFolder,
        Path databaseFile,
        boolean recursive,
        Duration settleInterval,
        int workers,
        int queueCapacity) {
}
