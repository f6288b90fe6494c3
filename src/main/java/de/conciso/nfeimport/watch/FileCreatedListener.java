package de.conciso.nfeimport.watch;

import java.nio.file.Path;

/**
 * Receives files that appeared in a watched folder tree.
 */
@FunctionalInterface
public interface FileCreatedListener {

    /**
     * Called on the watcher thread; implementations should hand off long work.
     *
     * @param file absolute path of the new file
     */
    void onFileCreated(Path file);
}
