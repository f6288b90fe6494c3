package de.conciso.nfeimport.model;

import java.nio.file.Path;

/**
 * A candidate file together with the names it is logged and recorded under.
 *
 * @param path         absolute location of the file when ingestion started
 * @param fileName     bare file name
 * @param relativePath path relative to the watched root, or the file name when the file lies outside it
 */
public record SourceFile(Path path, String fileName, String relativePath) {

    public static SourceFile of(Path path, Path watchedRoot) {
        Path absolute = path.toAbsolutePath().normalize();
        String fileName = absolute.getFileName().toString();
        String relative = absolute.startsWith(watchedRoot)
                ? watchedRoot.relativize(absolute).toString()
                : fileName;
        return new SourceFile(absolute, fileName, relative);
    }
}
