package de.conciso.nfeimport;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Appends one line per rejected document so that files in the error folder can be matched to their cause.
 */
@Component
public class RejectionLogWriter {

    private static final Logger log = LoggerFactory.getLogger(RejectionLogWriter.class);
    private static final DateTimeFormatter ARCHIVE_SUFFIX = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss-SSS");
    private static final int KEPT_ARCHIVES = 5;

    private final Path logPath;
    private final long maxSizeBytes;

    public RejectionLogWriter(
            @Value("${nfe.rejection-log.path:logs/nfe-rejections.log}") String rejectionLogPath,
            @Value("${nfe.rejection-log.max-size-kb:1024}") long maxSizeKb) {
        this.logPath = Path.of(rejectionLogPath).toAbsolutePath().normalize();
        this.maxSizeBytes = maxSizeKb * 1024;
    }

    public synchronized void logRejection(String file, IngestionException.Stage stage, String reason, Path destination) {
        String line = String.join(" | ",
                OffsetDateTime.now().toString(),
                "file=" + (file != null ? file : ""),
                "stage=" + (stage != null ? stage.name() : "UNEXPECTED"),
                "reason=" + singleLine(reason),
                "destination=" + (destination != null ? destination.toString() : "(left in place)"))
                + System.lineSeparator();
        try {
            Files.createDirectories(logPath.getParent());
            if (Files.exists(logPath) && Files.size(logPath) >= maxSizeBytes) {
                archiveCurrentLog();
            }
            Files.writeString(logPath, line, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.error("Rejection of {} not recorded in {}: {}", file, logPath, e.getMessage());
        }
    }

    private static String singleLine(String reason) {
        return reason == null ? "" : reason.replaceAll("[\\r\\n]+", " ");
    }

    /**
     * Renames the full log to {@code <name>.<timestamp>} and deletes all but the newest archives.
     */
    private void archiveCurrentLog() throws IOException {
        String prefix = logPath.getFileName() + ".";
        Path archive = logPath.resolveSibling(prefix + LocalDateTime.now().format(ARCHIVE_SUFFIX));
        for (int n = 1; Files.exists(archive); n++) {
            archive = logPath.resolveSibling(prefix + LocalDateTime.now().format(ARCHIVE_SUFFIX) + "-" + n);
        }
        Files.move(logPath, archive);
        log.info("Rejection log archived as {}", archive.getFileName());

        List<Path> archives;
        try (Stream<Path> siblings = Files.list(logPath.getParent())) {
            archives = siblings
                    .filter(p -> p.getFileName().toString().startsWith(prefix))
                    .sorted(Comparator.comparing((Path p) -> p.getFileName().toString()).reversed())
                    .toList();
        }
        for (Path old : archives.subList(Math.min(KEPT_ARCHIVES, archives.size()), archives.size())) {
            Files.deleteIfExists(old);
        }
    }
}
