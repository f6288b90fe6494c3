package de.conciso.nfeimport.routing;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import de.conciso.nfeimport.ProcessorSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Moves ingested files into the processed or error folder, appending {@code _001}, {@code _002}, ...
 * to the stem when the name is taken.
 */
@Component
public class FileRouter {

    private static final Logger log = LoggerFactory.getLogger(FileRouter.class);
    private static final int MAX_ATTEMPTS = 1000;

    private final Path processedFolder;
    private final Path errorFolder;

    public FileRouter(ProcessorSettings settings) {
        this.processedFolder = settings.processedFolder();
        this.errorFolder = settings.errorFolder();
    }

    public Path placeInProcessed(Path file) {
        return place(file, processedFolder);
    }

    public Path placeInError(Path file) {
        return place(file, errorFolder);
    }

    private synchronized Path place(Path file, Path targetFolder) {
        try {
            Files.createDirectories(targetFolder);
            Path destination = uniqueDestination(file.getFileName().toString(), targetFolder);
            move(file, destination);
            log.debug("Moved {} to {}", file, destination);
            return destination;
        } catch (IOException e) {
            throw new RoutingException("Failed to move " + file + " to " + targetFolder + ": " + e.getMessage(), e);
        }
    }

    static Path uniqueDestination(String fileName, Path targetFolder) throws IOException {
        Path candidate = targetFolder.resolve(fileName);
        if (!Files.exists(candidate)) {
            return candidate;
        }
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        String extension = dot > 0 ? fileName.substring(dot) : "";
        for (int counter = 1; counter <= MAX_ATTEMPTS; counter++) {
            candidate = targetFolder.resolve(String.format("%s_%03d%s", stem, counter, extension));
            if (!Files.exists(candidate)) {
                return candidate;
            }
        }
        throw new IOException("No free name for " + fileName + " in " + targetFolder + " after " + MAX_ATTEMPTS + " attempts");
    }

    private void move(Path source, Path destination) throws IOException {
        try {
            Files.move(source, destination, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic rename not possible for {}, copying across volumes", source);
            moveAcrossVolumes(source, destination);
        }
    }

    // the file exists in exactly one of the two places when this returns or throws
    void moveAcrossVolumes(Path source, Path destination) throws IOException {
        Path staging = destination.resolveSibling("." + destination.getFileName() + ".part");
        Files.copy(source, staging, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
        try {
            Files.move(staging, destination, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException moveFailure) {
            Files.deleteIfExists(staging);
            throw moveFailure;
        }
        try {
            deleteSource(source);
        } catch (IOException deleteFailure) {
            try {
                Files.deleteIfExists(destination);
            } catch (IOException cleanupFailure) {
                deleteFailure.addSuppressed(cleanupFailure);
            }
            throw deleteFailure;
        }
    }

    void deleteSource(Path source) throws IOException {
        Files.delete(source);
    }
}
