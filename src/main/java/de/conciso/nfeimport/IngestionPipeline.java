package de.conciso.nfeimport;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Phaser;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import com.fasterxml.jackson.databind.JsonNode;
import de.conciso.nfeimport.extraction.NfeExtractor;
import de.conciso.nfeimport.model.NfeDocument;
import de.conciso.nfeimport.model.SourceFile;
import de.conciso.nfeimport.parser.DocumentParseException;
import de.conciso.nfeimport.parser.DocumentParser;
import de.conciso.nfeimport.routing.FileRouter;
import de.conciso.nfeimport.routing.RoutingException;
import de.conciso.nfeimport.store.NfeDocumentStore;
import de.conciso.nfeimport.watch.DirectoryWatcher;
import de.conciso.nfeimport.watch.FileCreatedListener;
import de.conciso.nfeimport.watch.XmlFileSource;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Imports NF-e XML files from the watched folder: backlog sweep on startup, then creation events.
 */
@Component
public class IngestionPipeline implements FileCreatedListener {

    private static final Logger log = LoggerFactory.getLogger(IngestionPipeline.class);
    private static final String SEPARATOR = "=".repeat(60);

    private final ProcessorSettings settings;
    private final DocumentParser parser;
    private final NfeExtractor extractor;
    private final NfeDocumentStore store;
    private final FileRouter router;
    private final RejectionLogWriter rejectionLog;
    private final XmlFileSource source;
    private final DirectoryWatcher watcher;
    private final ThreadPoolExecutor workers;

    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final Set<Path> inFlight = ConcurrentHashMap.newKeySet();
    // one party for shutdown, plus one per running sweep or event import
    private final Phaser activeImports = new Phaser(1);

    public IngestionPipeline(
            ProcessorSettings settings,
            DocumentParser parser,
            NfeExtractor extractor,
            NfeDocumentStore store,
            FileRouter router,
            RejectionLogWriter rejectionLog) {
        this.settings = settings;
        this.parser = parser;
        this.extractor = extractor;
        this.store = store;
        this.router = router;
        this.rejectionLog = rejectionLog;
        this.source = new XmlFileSource(settings.xmlFolder(), settings.recursive());
        this.watcher = new DirectoryWatcher(source, this);

        int queueCapacity = Math.max(settings.queueCapacity(), settings.workers() * 4);
        this.workers = new ThreadPoolExecutor(
                settings.workers(),
                settings.workers(),
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(queueCapacity),
                newNamedDaemonFactory("nfe-ingest-"),
                new ThreadPoolExecutor.CallerRunsPolicy());
    }

    // ── Startup ─────────────────────────────────────────────────────────

    @EventListener(ApplicationReadyEvent.class)
    public void start() throws IOException {
        log.info("Starting NF-e import for {}", settings.xmlFolder());
        watcher.register();
        log.info(SEPARATOR);
        runBacklogSweep();
        log.info(SEPARATOR);
        if (isStopping()) {
            return;
        }
        watcher.start();
        log.info("Watching is active");
    }

    /**
     * Imports every XML file currently in the watched folder, sequentially and in listing order.
     *
     * @return number of files handed to {@link #ingest}
     */
    public int runBacklogSweep() {
        log.info("Processing existing XML files...");
        List<Path> files = source.listFiles();
        int processed = 0;
        for (Path file : files) {
            if (!Files.isRegularFile(file)) {
                continue;
            }
            log.info("Processing existing file: {}", SourceFile.of(file, settings.xmlFolder()).relativePath());
            if (ingestUnlessStopping(file) == null) {
                log.info("Stop requested, {} existing file(s) left for the next start", files.size() - processed);
                break;
            }
            processed++;
        }
        log.info("Initial processing finished: {} file(s) processed", processed);
        return processed;
    }

    // ── Live events ─────────────────────────────────────────────────────

    @Override
    public void onFileCreated(Path file) {
        Path path = file.toAbsolutePath().normalize();
        if (!XmlFileSource.isXmlFile(path)) {
            log.debug("Ignored (not XML): {}", path.getFileName());
            return;
        }
        if (!source.contains(path)) {
            log.debug("Ignored (outside watched folder): {}", path);
            return;
        }
        if (isStopping()) {
            return;
        }
        if (!inFlight.add(path)) {
            log.debug("Already queued: {}", path);
            return;
        }
        workers.execute(() -> {
            try {
                settleAndIngest(path);
            } finally {
                inFlight.remove(path);
            }
        });
    }

    private void settleAndIngest(Path path) {
        try {
            if (stopSignal.await(settings.settleInterval().toMillis(), TimeUnit.MILLISECONDS)) {
                log.debug("Stop requested, leaving {} for the next start", path.getFileName());
                return;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }
        if (!Files.exists(path)) {
            log.debug("File no longer exists: {}", path.getFileName());
            return;
        }
        log.info("New XML file detected: {}", SourceFile.of(path, settings.xmlFolder()).relativePath());
        ingestUnlessStopping(path);
    }

    /**
     * Runs {@link #ingest} as a tracked import that {@link #shutdown} waits for.
     *
     * @return the outcome, or {@code null} if stop was already requested
     */
    private IngestionOutcome ingestUnlessStopping(Path file) {
        activeImports.register();
        try {
            if (isStopping()) {
                return null;
            }
            return ingest(file);
        } finally {
            activeImports.arriveAndDeregister();
        }
    }

    // ── Ingestion ───────────────────────────────────────────────────────

    /**
     * Imports one file and moves it to the processed folder, or to the error folder if any step fails.
     * Never throws for document-level problems.
     */
    public IngestionOutcome ingest(Path file) {
        SourceFile sourceFile = SourceFile.of(file, settings.xmlFolder());
        AtomicReference<Path> location = new AtomicReference<>(sourceFile.path());
        log.info("Processing file: {}", sourceFile.relativePath());
        try {
            JsonNode tree = parser.parse(read(sourceFile));
            NfeDocument document = extractor.extract(tree);

            // the move runs inside the transaction: a failed move rolls the rows back
            Path destination = store.upsertDocument(document, sourceFile, () -> {
                Path moved = router.placeInProcessed(sourceFile.path());
                location.set(moved);
                return moved;
            });

            log.info("File processed successfully: {}", sourceFile.fileName());
            return IngestionOutcome.committed(sourceFile, document.accessKey(), destination);
        } catch (IngestionException e) {
            log.error("Error processing {}: {}", sourceFile.relativePath(), e.getMessage());
            return reject(sourceFile, location.get(), e.stage(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error processing {}: {}", sourceFile.relativePath(), e.getMessage(), e);
            return reject(sourceFile, location.get(), null, e.toString());
        }
    }

    private byte[] read(SourceFile sourceFile) {
        try {
            return Files.readAllBytes(sourceFile.path());
        } catch (IOException e) {
            throw new DocumentParseException("Cannot read " + sourceFile.relativePath() + ": " + e.getMessage(), e);
        }
    }

    private IngestionOutcome reject(SourceFile sourceFile, Path location, IngestionException.Stage stage, String reason) {
        Path destination = null;
        try {
            destination = router.placeInError(location);
            log.info("File moved to error folder: {}", destination.getFileName());
        } catch (RoutingException e) {
            log.error("Failed to move {} to error folder, leaving it at {}: {}",
                    sourceFile.relativePath(), location, e.getMessage());
        }
        rejectionLog.logRejection(sourceFile.relativePath(), stage, reason, destination);
        return IngestionOutcome.rejected(sourceFile, stage, reason, destination);
    }

    // ── Shutdown ────────────────────────────────────────────────────────

    private boolean isStopping() {
        return stopSignal.getCount() == 0;
    }

    @PreDestroy
    public void shutdown() {
        log.info("Stopping NF-e import...");
        stopSignal.countDown();
        watcher.close();

        workers.shutdown();
        try {
            activeImports.awaitAdvanceInterruptibly(activeImports.arrive(), 30, TimeUnit.SECONDS);
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Forcing shutdown of ingest workers...");
                workers.shutdownNow();
            }
        } catch (TimeoutException e) {
            log.warn("Imports still running after 30 s, forcing shutdown");
            workers.shutdownNow();
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("NF-e import stopped");
    }

    private static ThreadFactory newNamedDaemonFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable);
            t.setName(prefix + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
    }
}
