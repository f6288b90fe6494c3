package de.conciso.nfeimport.watch;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports XML files created in a folder to a {@link FileCreatedListener}. Events arriving between
 * {@link #register()} and {@link #start()} are queued, not lost.
 */
public class DirectoryWatcher implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(DirectoryWatcher.class);

    private final XmlFileSource source;
    private final FileCreatedListener listener;
    private final Map<WatchKey, Path> watchKeys = new ConcurrentHashMap<>();

    private volatile WatchService watchService;
    private volatile Thread watcherThread;

    public DirectoryWatcher(XmlFileSource source, FileCreatedListener listener) {
        this.source = source;
        this.listener = listener;
    }

    public synchronized void register() throws IOException {
        if (watchService != null) {
            return;
        }
        watchService = FileSystems.getDefault().newWatchService();
        if (source.recursive()) {
            registerAll(source.directory());
        } else {
            registerDirectory(source.directory());
        }
        log.info("Registered {} folder(s) for watching under {}", watchKeys.size(), source.directory());
    }

    public synchronized void start() throws IOException {
        register();
        if (watcherThread != null) {
            return;
        }
        watcherThread = new Thread(this::watchLoop, "nfe-watch");
        watcherThread.start();
    }

    public boolean isRunning() {
        Thread thread = watcherThread;
        return thread != null && thread.isAlive();
    }

    @Override
    public void close() {
        WatchService ws = watchService;
        if (ws != null) {
            try {
                ws.close();
            } catch (IOException e) {
                log.warn("Failed to close watch service: {}", e.getMessage());
            }
        }
        Thread thread = watcherThread;
        if (thread != null && thread != Thread.currentThread()) {
            try {
                thread.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void watchLoop() {
        log.info("Watching {} for new XML files", source.directory());
        try {
            while (true) {
                WatchKey key = watchService.take();
                Path dir = watchKeys.get(key);
                if (dir == null) {
                    key.reset();
                    continue;
                }
                handleEvents(key, dir);
                if (!key.reset()) {
                    watchKeys.remove(key);
                    if (dir.equals(source.directory())) {
                        log.error("Watched folder {} is no longer accessible", dir);
                        break;
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Watcher thread interrupted");
        } catch (ClosedWatchServiceException e) {
            log.info("Watcher stopped");
        }
    }

    private void handleEvents(WatchKey key, Path dir) {
        for (WatchEvent<?> event : key.pollEvents()) {
            WatchEvent.Kind<?> kind = event.kind();
            if (kind == StandardWatchEventKinds.OVERFLOW) {
                log.warn("Watch event overflow in {}, rescanning", dir);
                reportExisting(dir);
                continue;
            }
            Path relative = (Path) event.context();
            if (relative == null) {
                continue;
            }
            Path child = dir.resolve(relative);
            if (Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS)) {
                if (source.recursive()) {
                    try {
                        registerAll(child);
                    } catch (IOException e) {
                        log.warn("Unable to watch new folder {}: {}", child, e.getMessage());
                    }
                    reportExisting(child);
                }
            } else if (XmlFileSource.isXmlFile(child)) {
                dispatch(child);
            } else {
                log.debug("Ignored (not XML): {}", child.getFileName());
            }
        }
    }

    private void reportExisting(Path dir) {
        for (Path file : source.listFiles(dir)) {
            dispatch(file);
        }
    }

    private void dispatch(Path file) {
        try {
            listener.onFileCreated(file);
        } catch (RuntimeException e) {
            log.error("Listener failed for {}: {}", file, e.getMessage(), e);
        }
    }

    private void registerAll(Path start) throws IOException {
        Files.walkFileTree(start, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                registerDirectory(dir);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                log.warn("Unable to access {}: {}", file, exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private void registerDirectory(Path dir) throws IOException {
        if (watchKeys.containsValue(dir)) {
            return;
        }
        WatchKey key = dir.register(watchService, StandardWatchEventKinds.ENTRY_CREATE);
        watchKeys.put(key, dir);
    }
}
