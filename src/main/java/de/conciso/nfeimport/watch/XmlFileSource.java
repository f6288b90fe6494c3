package de.conciso.nfeimport.watch;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lists the XML documents currently present in a folder, either flat or including sub folders.
 * Listing order is whatever the file system reports.
 */
public class XmlFileSource {

    private static final Logger log = LoggerFactory.getLogger(XmlFileSource.class);
    private static final String XML_EXTENSION = ".xml";

    private final Path directory;
    private final boolean recursive;

    public XmlFileSource(Path directory, boolean recursive) {
        this.directory = directory;
        this.recursive = recursive;
    }

    public Path directory() {
        return directory;
    }

    public boolean recursive() {
        return recursive;
    }

    public List<Path> listFiles() {
        return listFiles(directory);
    }

    /**
     * Lists XML files below {@code folder}, which is expected to lie inside the watched folder.
     */
    public List<Path> listFiles(Path folder) {
        try (Stream<Path> files = recursive ? Files.walk(folder) : Files.list(folder)) {
            List<Path> result = files
                    .filter(Files::isRegularFile)
                    .filter(XmlFileSource::isXmlFile)
                    .toList();
            log.debug("Listed {} XML file(s) in {}", result.size(), folder);
            return result;
        } catch (IOException | UncheckedIOException e) {
            log.error("Listing failed for {}: {}", folder, e.getMessage());
            return List.of();
        }
    }

    public boolean contains(Path file) {
        Path absolute = file.toAbsolutePath().normalize();
        if (!absolute.startsWith(directory) || absolute.equals(directory)) {
            return false;
        }
        return recursive || directory.equals(absolute.getParent());
    }

    public static boolean isXmlFile(Path file) {
        Path name = file.getFileName();
        return name != null && name.toString().toLowerCase(Locale.ROOT).endsWith(XML_EXTENSION);
    }
}
